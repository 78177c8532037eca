package com.energy.model;

import java.time.Instant;

/**
 * Показание сетевого счётчика, полученное от устройства.
 * Используется для десериализации JSON-запроса.
 */
public class MeterReading {

  private String meterId;
  private double kwhConsumedAc;
  private double voltage;
  private Instant timestamp;

  /**
   * Конструктор по умолчанию. Обязателен для работы с Jackson.
   */
  public MeterReading() {}

  public MeterReading(String meterId, double kwhConsumedAc, double voltage, Instant timestamp) {
    this.meterId = meterId;
    this.kwhConsumedAc = kwhConsumedAc;
    this.voltage = voltage;
    this.timestamp = timestamp;
  }

  /**
   * @return Идентификатор счётчика (например, "METER-001").
   */
  public String getMeterId() {
    return meterId;
  }

  public void setMeterId(String meterId) {
    this.meterId = meterId;
  }

  /**
   * @return Потреблённая из сети энергия переменного тока, кВт·ч.
   */
  public double getKwhConsumedAc() {
    return kwhConsumedAc;
  }

  public void setKwhConsumedAc(double kwhConsumedAc) {
    this.kwhConsumedAc = kwhConsumedAc;
  }

  /**
   * @return Напряжение, В.
   */
  public double getVoltage() {
    return voltage;
  }

  public void setVoltage(double voltage) {
    this.voltage = voltage;
  }

  /**
   * @return Время снятия показания на устройстве.
   */
  public Instant getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(Instant timestamp) {
    this.timestamp = timestamp;
  }

  @Override
  public String toString() {
    return "MeterReading{meterId='" + meterId + "', kwhConsumedAc=" + kwhConsumedAc
        + ", voltage=" + voltage + ", timestamp=" + timestamp + '}';
  }
}
