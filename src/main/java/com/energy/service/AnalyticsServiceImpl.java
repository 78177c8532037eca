package com.energy.service;

import com.energy.db.TelemetryDao;
import com.energy.model.MeterHistoryAggregate;
import com.energy.model.MeterLiveState;
import com.energy.model.PerformanceMetrics;
import com.energy.model.VehicleHistoryAggregate;
import com.energy.model.VehicleLiveState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Реализация аналитики. Существование устройства определяется только по живому состоянию,
 * агрегаты истории считаются в БД по индексу (id, timestamp).
 */
public class AnalyticsServiceImpl implements AnalyticsService {

  private static final Logger logger = LoggerFactory.getLogger(AnalyticsServiceImpl.class);

  static final Duration PERFORMANCE_WINDOW = Duration.ofHours(24);

  private final TelemetryDao telemetryDao;
  private final Clock clock;

  public AnalyticsServiceImpl(TelemetryDao telemetryDao) {
    this(telemetryDao, Clock.systemUTC());
  }

  /**
   * @param telemetryDao DAO для работы с БД.
   * @param clock Источник текущего времени для окна аналитики.
   */
  public AnalyticsServiceImpl(TelemetryDao telemetryDao, Clock clock) {
    this.telemetryDao = telemetryDao;
    this.clock = clock;
  }

  @Override
  public PerformanceMetrics getVehiclePerformance(String vehicleId) {
    return getVehiclePerformance(vehicleId, clock.instant());
  }

  @Override
  public PerformanceMetrics getVehiclePerformance(String vehicleId, Instant now) {
    Instant windowStart = now.minus(PERFORMANCE_WINDOW);

    if (telemetryDao.readVehicleLiveState(vehicleId).isEmpty()) {
      throw new NotFoundException("Vehicle " + vehicleId + " not found");
    }

    VehicleHistoryAggregate vehicle = telemetryDao.aggregateVehicleHistory(vehicleId, windowStart, now);
    // Связки электромобиль -> счётчик нет, счётчик ищется по тому же идентификатору
    MeterHistoryAggregate meter = telemetryDao.aggregateMeterHistory(vehicleId, windowStart, now);

    double energyDeliveredDc = vehicle.getTotalKwhDeliveredDc();
    double energyConsumedAc = meter.getTotalKwhConsumedAc();
    double efficiency = energyConsumedAc > 0 ? energyDeliveredDc / energyConsumedAc : 0;

    logger.debug("Аналитика {} за [{}, {}]: {} строк ТС, {} строк счётчика",
        vehicleId, windowStart, now, vehicle.getCount(), meter.getCount());

    return new PerformanceMetrics(
        vehicleId,
        new PerformanceMetrics.Period(windowStart, now),
        energyConsumedAc,
        energyDeliveredDc,
        roundToHundredths(efficiency * 100),
        roundToHundredths(vehicle.getAverageBatteryTemp()),
        new PerformanceMetrics.DataPoints(vehicle.getCount(), meter.getCount())
    );
  }

  @Override
  public VehicleLiveState getVehicleLiveState(String vehicleId) {
    return telemetryDao.readVehicleLiveState(vehicleId)
        .orElseThrow(() -> new NotFoundException("Vehicle " + vehicleId + " not found"));
  }

  @Override
  public MeterLiveState getMeterLiveState(String meterId) {
    return telemetryDao.readMeterLiveState(meterId)
        .orElseThrow(() -> new NotFoundException("Meter " + meterId + " not found"));
  }

  static double roundToHundredths(double value) {
    return Math.round(value * 100) / 100.0;
  }
}
