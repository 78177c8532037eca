package com.energy.model;

import java.time.Instant;

/**
 * Телеметрия электромобиля, полученная от устройства.
 * Используется для десериализации JSON-запроса.
 */
public class VehicleReading {

  private String vehicleId;
  private double soc;
  private double kwhDeliveredDc;
  private double batteryTemp;
  private Instant timestamp;

  /**
   * Конструктор по умолчанию. Обязателен для работы с Jackson.
   */
  public VehicleReading() {}

  public VehicleReading(String vehicleId, double soc, double kwhDeliveredDc, double batteryTemp, Instant timestamp) {
    this.vehicleId = vehicleId;
    this.soc = soc;
    this.kwhDeliveredDc = kwhDeliveredDc;
    this.batteryTemp = batteryTemp;
    this.timestamp = timestamp;
  }

  public String getVehicleId() {
    return vehicleId;
  }

  public void setVehicleId(String vehicleId) {
    this.vehicleId = vehicleId;
  }

  /**
   * @return Уровень заряда батареи, 0–100 %.
   */
  public double getSoc() {
    return soc;
  }

  public void setSoc(double soc) {
    this.soc = soc;
  }

  /**
   * @return Энергия постоянного тока, отданная в батарею, кВт·ч.
   */
  public double getKwhDeliveredDc() {
    return kwhDeliveredDc;
  }

  public void setKwhDeliveredDc(double kwhDeliveredDc) {
    this.kwhDeliveredDc = kwhDeliveredDc;
  }

  /**
   * @return Температура батареи. Знак не ограничен.
   */
  public double getBatteryTemp() {
    return batteryTemp;
  }

  public void setBatteryTemp(double batteryTemp) {
    this.batteryTemp = batteryTemp;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(Instant timestamp) {
    this.timestamp = timestamp;
  }

  @Override
  public String toString() {
    return "VehicleReading{vehicleId='" + vehicleId + "', soc=" + soc + ", kwhDeliveredDc=" + kwhDeliveredDc
        + ", batteryTemp=" + batteryTemp + ", timestamp=" + timestamp + '}';
  }
}
