package com.energy.model;

/**
 * Итог пакетной загрузки: только счётчики, без ошибок по отдельным элементам.
 */
public class BatchResult {

  private final int total;
  private final int successful;
  private final int failed;

  public BatchResult(int total, int successful, int failed) {
    this.total = total;
    this.successful = successful;
    this.failed = failed;
  }

  public int getTotal() {
    return total;
  }

  public int getSuccessful() {
    return successful;
  }

  public int getFailed() {
    return failed;
  }

  @Override
  public String toString() {
    return "BatchResult{total=" + total + ", successful=" + successful + ", failed=" + failed + '}';
  }
}
