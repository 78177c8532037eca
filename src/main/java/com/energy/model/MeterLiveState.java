package com.energy.model;

import java.time.Instant;

/**
 * Текущее состояние счётчика: одна строка на meterId, перезаписывается при каждом показании.
 */
public class MeterLiveState {

  private final String meterId;
  private final double kwhConsumedAc;
  private final double voltage;
  private final Instant lastUpdatedAt;

  public MeterLiveState(String meterId, double kwhConsumedAc, double voltage, Instant lastUpdatedAt) {
    this.meterId = meterId;
    this.kwhConsumedAc = kwhConsumedAc;
    this.voltage = voltage;
    this.lastUpdatedAt = lastUpdatedAt;
  }

  public String getMeterId() {
    return meterId;
  }

  public double getKwhConsumedAc() {
    return kwhConsumedAc;
  }

  public double getVoltage() {
    return voltage;
  }

  public Instant getLastUpdatedAt() {
    return lastUpdatedAt;
  }
}
