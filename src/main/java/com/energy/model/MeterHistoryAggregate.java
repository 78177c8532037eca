package com.energy.model;

/**
 * Агрегат истории счётчика за временное окно. Пустое окно даёт нули.
 */
public class MeterHistoryAggregate {

  private final double totalKwhConsumedAc;
  private final long count;

  public MeterHistoryAggregate(double totalKwhConsumedAc, long count) {
    this.totalKwhConsumedAc = totalKwhConsumedAc;
    this.count = count;
  }

  public double getTotalKwhConsumedAc() {
    return totalKwhConsumedAc;
  }

  public long getCount() {
    return count;
  }
}
