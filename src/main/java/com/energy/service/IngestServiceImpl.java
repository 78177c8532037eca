package com.energy.service;

import com.energy.db.StorageException;
import com.energy.db.TelemetryDao;
import com.energy.model.BatchResult;
import com.energy.model.IngestResult;
import com.energy.model.MeterReading;
import com.energy.model.VehicleReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Реализация сервиса приёма телеметрии.
 * <p>
 * Элементы пакета выполняются на пуле фиксированного размера, так что число
 * одновременных транзакций ограничено размером пула независимо от размера пакета.
 */
public class IngestServiceImpl implements IngestService, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(IngestServiceImpl.class);

  private final TelemetryDao telemetryDao;
  private final ExecutorService batchExecutor;

  /**
   * @param telemetryDao DAO для работы с БД.
   * @param batchConcurrency Максимум одновременных записей при пакетной загрузке.
   */
  public IngestServiceImpl(TelemetryDao telemetryDao, int batchConcurrency) {
    this(telemetryDao, Executors.newFixedThreadPool(requirePositive(batchConcurrency), new BatchThreadFactory()));
  }

  /**
   * @param telemetryDao DAO для работы с БД.
   * @param batchExecutor Пул для элементов пакета; сервис владеет им и закрывает в {@link #close()}.
   */
  public IngestServiceImpl(TelemetryDao telemetryDao, ExecutorService batchExecutor) {
    this.telemetryDao = telemetryDao;
    this.batchExecutor = batchExecutor;
  }

  @Override
  public IngestResult ingestMeter(MeterReading reading) {
    if (reading == null) {
      throw new IllegalArgumentException("Meter reading cannot be null");
    }
    try {
      telemetryDao.writeMeterReading(reading);
    } catch (StorageException e) {
      logger.error("❌ Не удалось сохранить показание счётчика {}: {}", reading.getMeterId(), e.getMessage());
      throw e;
    }
    logger.info("✅ Показание счётчика {} сохранено", reading.getMeterId());
    return IngestResult.forMeter(reading.getMeterId());
  }

  @Override
  public IngestResult ingestVehicle(VehicleReading reading) {
    if (reading == null) {
      throw new IllegalArgumentException("Vehicle reading cannot be null");
    }
    try {
      telemetryDao.writeVehicleReading(reading);
    } catch (StorageException e) {
      logger.error("❌ Не удалось сохранить телеметрию электромобиля {}: {}", reading.getVehicleId(), e.getMessage());
      throw e;
    }
    logger.info("✅ Телеметрия электромобиля {} сохранена", reading.getVehicleId());
    return IngestResult.forVehicle(reading.getVehicleId());
  }

  @Override
  public BatchResult ingestMeterBatch(List<MeterReading> readings) {
    return ingestBatch("meter", readings, this::ingestMeter);
  }

  @Override
  public BatchResult ingestVehicleBatch(List<VehicleReading> readings) {
    return ingestBatch("vehicle", readings, this::ingestVehicle);
  }

  private <T> BatchResult ingestBatch(String kind, List<T> readings, Consumer<T> ingestOne) {
    if (readings == null) {
      throw new IllegalArgumentException("Batch cannot be null");
    }

    List<CompletableFuture<Void>> futures = new ArrayList<>(readings.size());
    for (T reading : readings) {
      futures.add(CompletableFuture.runAsync(() -> ingestOne.accept(reading), batchExecutor));
    }

    // Ждём завершения каждого элемента, успешного или нет
    int failed = 0;
    for (CompletableFuture<Void> future : futures) {
      try {
        future.join();
      } catch (CompletionException e) {
        failed++;
        logger.warn("Элемент пакета ({}) не сохранён: {}", kind, e.getCause() != null ? e.getCause().toString() : e.toString());
      }
    }

    BatchResult result = new BatchResult(readings.size(), readings.size() - failed, failed);
    logger.info("Пакет ({}) обработан: {}", kind, result);
    return result;
  }

  /**
   * Останавливает пул пакетной загрузки, дожидаясь уже принятых элементов.
   */
  @Override
  public void close() {
    batchExecutor.shutdown();
    try {
      if (!batchExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
        logger.warn("Пул пакетной загрузки не остановился за 30 с, прерываем задачи");
        batchExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      batchExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static int requirePositive(int batchConcurrency) {
    if (batchConcurrency <= 0) {
      throw new IllegalArgumentException("Batch concurrency must be positive, got " + batchConcurrency);
    }
    return batchConcurrency;
  }

  private static final class BatchThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, "ingest-batch-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
