package com.energy.model;

import java.time.Instant;

/**
 * Показатели эффективности зарядки электромобиля за скользящее окно.
 */
public class PerformanceMetrics {

  private final String vehicleId;
  private final Period period;
  private final double energyConsumedAc;
  private final double energyDeliveredDc;
  private final double efficiencyRatio;
  private final double averageBatteryTemp;
  private final DataPoints dataPoints;

  public PerformanceMetrics(String vehicleId, Period period, double energyConsumedAc, double energyDeliveredDc,
                            double efficiencyRatio, double averageBatteryTemp, DataPoints dataPoints) {
    this.vehicleId = vehicleId;
    this.period = period;
    this.energyConsumedAc = energyConsumedAc;
    this.energyDeliveredDc = energyDeliveredDc;
    this.efficiencyRatio = efficiencyRatio;
    this.averageBatteryTemp = averageBatteryTemp;
    this.dataPoints = dataPoints;
  }

  public String getVehicleId() {
    return vehicleId;
  }

  public Period getPeriod() {
    return period;
  }

  public double getEnergyConsumedAc() {
    return energyConsumedAc;
  }

  public double getEnergyDeliveredDc() {
    return energyDeliveredDc;
  }

  /**
   * @return Отношение DC/AC в процентах, округлённое до сотых; 0, если AC-энергии не было.
   */
  public double getEfficiencyRatio() {
    return efficiencyRatio;
  }

  public double getAverageBatteryTemp() {
    return averageBatteryTemp;
  }

  public DataPoints getDataPoints() {
    return dataPoints;
  }

  /**
   * Границы окна, обе включительно.
   */
  public static class Period {

    private final Instant start;
    private final Instant end;

    public Period(Instant start, Instant end) {
      this.start = start;
      this.end = end;
    }

    public Instant getStart() {
      return start;
    }

    public Instant getEnd() {
      return end;
    }
  }

  /**
   * Количество строк истории, попавших в окно.
   */
  public static class DataPoints {

    private final long vehicle;
    private final long meter;

    public DataPoints(long vehicle, long meter) {
      this.vehicle = vehicle;
      this.meter = meter;
    }

    public long getVehicle() {
      return vehicle;
    }

    public long getMeter() {
      return meter;
    }
  }
}
