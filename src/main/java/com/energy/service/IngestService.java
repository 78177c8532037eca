package com.energy.service;

import com.energy.model.BatchResult;
import com.energy.model.IngestResult;
import com.energy.model.MeterReading;
import com.energy.model.VehicleReading;

import java.util.List;

/**
 * Сервис приёма телеметрии от счётчиков и электромобилей.
 * <p>
 * Показания приходят уже проверенными на границе HTTP; сервис их не перепроверяет,
 * а только атомарно записывает в историю и живое состояние.
 */
public interface IngestService {

  /**
   * Сохраняет одно показание счётчика.
   *
   * @param reading Проверенное показание.
   * @return {success=true, meterId}.
   * @throws com.energy.db.StorageException если запись не удалась.
   */
  IngestResult ingestMeter(MeterReading reading);

  /**
   * Сохраняет одно показание электромобиля.
   *
   * @param reading Проверенное показание.
   * @return {success=true, vehicleId}.
   * @throws com.energy.db.StorageException если запись не удалась.
   */
  IngestResult ingestVehicle(VehicleReading reading);

  /**
   * Сохраняет пакет показаний счётчиков. Каждый элемент пишется независимо;
   * ошибка одного элемента не отменяет остальные. Порядок обработки не гарантируется.
   * Элемент {@code null} (отклонён на границе) учитывается как неудачный.
   *
   * @return Количество всего / успешно / с ошибкой.
   */
  BatchResult ingestMeterBatch(List<MeterReading> readings);

  /**
   * Пакетный аналог {@link #ingestVehicle(VehicleReading)}, семантика как у {@link #ingestMeterBatch(List)}.
   */
  BatchResult ingestVehicleBatch(List<VehicleReading> readings);
}
