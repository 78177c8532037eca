package com.energy.model;

import java.time.Instant;

/**
 * Текущее состояние электромобиля: одна строка на vehicleId.
 */
public class VehicleLiveState {

  private final String vehicleId;
  private final double soc;
  private final double kwhDeliveredDc;
  private final double batteryTemp;
  private final Instant lastUpdatedAt;

  public VehicleLiveState(String vehicleId, double soc, double kwhDeliveredDc, double batteryTemp, Instant lastUpdatedAt) {
    this.vehicleId = vehicleId;
    this.soc = soc;
    this.kwhDeliveredDc = kwhDeliveredDc;
    this.batteryTemp = batteryTemp;
    this.lastUpdatedAt = lastUpdatedAt;
  }

  public String getVehicleId() {
    return vehicleId;
  }

  public double getSoc() {
    return soc;
  }

  public double getKwhDeliveredDc() {
    return kwhDeliveredDc;
  }

  public double getBatteryTemp() {
    return batteryTemp;
  }

  public Instant getLastUpdatedAt() {
    return lastUpdatedAt;
  }
}
