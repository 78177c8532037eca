package com.energy.model;

/**
 * Агрегат истории электромобиля за временное окно. Пустое окно даёт нули.
 */
public class VehicleHistoryAggregate {

  private final double totalKwhDeliveredDc;
  private final double averageBatteryTemp;
  private final long count;

  public VehicleHistoryAggregate(double totalKwhDeliveredDc, double averageBatteryTemp, long count) {
    this.totalKwhDeliveredDc = totalKwhDeliveredDc;
    this.averageBatteryTemp = averageBatteryTemp;
    this.count = count;
  }

  public double getTotalKwhDeliveredDc() {
    return totalKwhDeliveredDc;
  }

  public double getAverageBatteryTemp() {
    return averageBatteryTemp;
  }

  public long getCount() {
    return count;
  }
}
