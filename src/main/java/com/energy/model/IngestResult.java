package com.energy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Результат приёма одного показания.
 * <p>
 * Заполняется ровно один из идентификаторов, второй не попадает в JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestResult {

  private final boolean success;
  private final String meterId;
  private final String vehicleId;

  private IngestResult(boolean success, String meterId, String vehicleId) {
    this.success = success;
    this.meterId = meterId;
    this.vehicleId = vehicleId;
  }

  public static IngestResult forMeter(String meterId) {
    return new IngestResult(true, meterId, null);
  }

  public static IngestResult forVehicle(String vehicleId) {
    return new IngestResult(true, null, vehicleId);
  }

  public boolean isSuccess() {
    return success;
  }

  public String getMeterId() {
    return meterId;
  }

  public String getVehicleId() {
    return vehicleId;
  }
}
