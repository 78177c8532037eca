package com.energy.service;

import com.energy.model.MeterLiveState;
import com.energy.model.PerformanceMetrics;
import com.energy.model.VehicleLiveState;

import java.time.Instant;

/**
 * Аналитика по живому состоянию и истории телеметрии.
 */
public interface AnalyticsService {

  /**
   * Считает показатели электромобиля за окно [now − 24ч, now].
   * <p>
   * AC-энергия берётся из истории счётчика с тем же идентификатором, что и у электромобиля.
   *
   * @throws NotFoundException если у электромобиля нет живого состояния.
   */
  PerformanceMetrics getVehiclePerformance(String vehicleId, Instant now);

  /**
   * То же, что {@link #getVehiclePerformance(String, Instant)} для текущего момента.
   */
  PerformanceMetrics getVehiclePerformance(String vehicleId);

  /**
   * @throws NotFoundException если живого состояния нет.
   */
  VehicleLiveState getVehicleLiveState(String vehicleId);

  /**
   * @throws NotFoundException если живого состояния нет.
   */
  MeterLiveState getMeterLiveState(String meterId);
}
