package com.energy.db;

import com.energy.model.MeterHistoryAggregate;
import com.energy.model.MeterLiveState;
import com.energy.model.MeterReading;
import com.energy.model.VehicleHistoryAggregate;
import com.energy.model.VehicleLiveState;
import com.energy.model.VehicleReading;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Интеграционные тесты DAO на реальном PostgreSQL.
 * <p>
 * Проверяют атомарность двойной записи, семантику upsert живого состояния,
 * неизменяемость истории, границы окна агрегации и использование индексов.
 */
@Testcontainers(disabledWithoutDocker = true)
class TelemetryDaoIntegrationTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:15")
          .withDatabaseName("energy_db")
          .withUsername("energy_user")
          .withPassword("energy_pass");

  private static final Instant BASE = Instant.parse("2026-02-09T12:00:00Z");

  private static DatabaseConnection database;
  private TelemetryDao dao;

  @BeforeAll
  static void setUpSchema() {
    database = new DatabaseConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    database.initializeDatabase();
  }

  @BeforeEach
  void setUp() throws SQLException {
    dao = new TelemetryDao(database);
    try (Connection conn = database.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE meter_live_state, vehicle_live_state, meter_telemetry_history, vehicle_telemetry_history RESTART IDENTITY");
    }
  }

  @Test
  @DisplayName("Показание счётчика → одна строка истории и живое состояние")
  void shouldWriteHistoryAndLiveStateTogether() throws SQLException {
    dao.writeMeterReading(new MeterReading("M-1", 12.5, 230.0, BASE));

    assertThat(countRows("meter_telemetry_history", "meterId", "M-1")).isEqualTo(1);
    MeterLiveState state = dao.readMeterLiveState("M-1").orElseThrow();
    assertThat(state.getKwhConsumedAc()).isEqualTo(12.5);
    assertThat(state.getVoltage()).isEqualTo(230.0);
    assertThat(state.getLastUpdatedAt()).isEqualTo(BASE);
  }

  @Test
  @DisplayName("Живое состояние = последнее принятое показание, даже если его timestamp старше")
  void liveStateShouldFollowIngestionOrderNotTimestampOrder() {
    dao.writeVehicleReading(new VehicleReading("EV-1", 40.0, 5.0, 21.0, BASE));
    dao.writeVehicleReading(new VehicleReading("EV-1", 35.0, 7.5, 19.5, BASE.minus(3, ChronoUnit.HOURS)));

    VehicleLiveState state = dao.readVehicleLiveState("EV-1").orElseThrow();
    assertThat(state.getSoc()).isEqualTo(35.0);
    assertThat(state.getKwhDeliveredDc()).isEqualTo(7.5);
    assertThat(state.getBatteryTemp()).isEqualTo(19.5);
    assertThat(state.getLastUpdatedAt()).isEqualTo(BASE.minus(3, ChronoUnit.HOURS));
  }

  @Test
  @DisplayName("История только растёт: N показаний → N строк, прежние строки не меняются")
  void historyShouldBeAppendOnly() throws SQLException {
    dao.writeMeterReading(new MeterReading("M-1", 1.0, 229.0, BASE));
    dao.writeMeterReading(new MeterReading("M-1", 2.0, 230.0, BASE.minus(1, ChronoUnit.HOURS)));
    List<String> before = historySnapshot("M-1");

    dao.writeMeterReading(new MeterReading("M-1", 3.0, 231.0, BASE.minus(2, ChronoUnit.HOURS)));

    List<String> after = historySnapshot("M-1");
    assertThat(after).hasSize(3);
    assertThat(after.subList(0, 2)).isEqualTo(before);
  }

  @Test
  @DisplayName("Сбой между вставкой в историю и upsert → не видно ни одной записи")
  void faultBetweenStatementsShouldLeaveNothingVisible() throws SQLException {
    TelemetryDao faulty = new TelemetryDao(database) {
      @Override
      protected void upsertMeterLiveState(Connection conn, MeterReading reading) throws SQLException {
        throw new SQLException("injected fault");
      }

      @Override
      protected void upsertVehicleLiveState(Connection conn, VehicleReading reading) throws SQLException {
        throw new SQLException("injected fault");
      }
    };

    assertThatThrownBy(() -> faulty.writeMeterReading(new MeterReading("M-1", 1.0, 230.0, BASE)))
        .isInstanceOf(StorageException.class)
        .hasRootCauseMessage("injected fault");
    assertThatThrownBy(() -> faulty.writeVehicleReading(new VehicleReading("EV-1", 50.0, 1.0, 20.0, BASE)))
        .isInstanceOf(StorageException.class);

    assertThat(countRows("meter_telemetry_history", "meterId", "M-1")).isZero();
    assertThat(dao.readMeterLiveState("M-1")).isEmpty();
    assertThat(countRows("vehicle_telemetry_history", "vehicleId", "EV-1")).isZero();
    assertThat(dao.readVehicleLiveState("EV-1")).isEmpty();
  }

  @Test
  @DisplayName("Сбой при повторном показании → прежнее состояние и история не тронуты")
  void faultOnKnownDeviceShouldKeepPreviousState() throws SQLException {
    dao.writeMeterReading(new MeterReading("M-1", 1.0, 230.0, BASE));
    TelemetryDao faulty = new TelemetryDao(database) {
      @Override
      protected void upsertMeterLiveState(Connection conn, MeterReading reading) throws SQLException {
        throw new SQLException("injected fault");
      }
    };

    assertThatThrownBy(() -> faulty.writeMeterReading(new MeterReading("M-1", 9.0, 240.0, BASE.plusSeconds(60))))
        .isInstanceOf(StorageException.class);

    assertThat(countRows("meter_telemetry_history", "meterId", "M-1")).isEqualTo(1);
    assertThat(dao.readMeterLiveState("M-1").orElseThrow().getKwhConsumedAc()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Нарушение ограничения столбца → транзакция откатывается целиком")
  void constraintViolationShouldFailWholeTransaction() throws SQLException {
    assertThatThrownBy(() -> dao.writeMeterReading(new MeterReading("M-1", -1.0, 230.0, BASE)))
        .isInstanceOf(StorageException.class);
    assertThatThrownBy(() -> dao.writeVehicleReading(new VehicleReading("EV-1", 150.0, 1.0, 20.0, BASE)))
        .isInstanceOf(StorageException.class);
    assertThatThrownBy(() -> dao.writeMeterReading(new MeterReading("M-2", 1.0, 230.0, null)))
        .isInstanceOf(StorageException.class);

    assertThat(countRows("meter_telemetry_history", "meterId", "M-1")).isZero();
    assertThat(countRows("meter_telemetry_history", "meterId", "M-2")).isZero();
    assertThat(countRows("vehicle_telemetry_history", "vehicleId", "EV-1")).isZero();
    assertThat(dao.readMeterLiveState("M-1")).isEmpty();
    assertThat(dao.readVehicleLiveState("EV-1")).isEmpty();
  }

  @Test
  @DisplayName("Окно агрегации включает обе границы и не захватывает чужие устройства")
  void aggregatesShouldRespectInclusiveWindowAndDeviceId() {
    Instant from = BASE.minus(24, ChronoUnit.HOURS);
    dao.writeMeterReading(new MeterReading("M-1", 100.0, 230.0, from.minusMillis(1)));
    dao.writeMeterReading(new MeterReading("M-1", 1.5, 230.0, from));
    dao.writeMeterReading(new MeterReading("M-1", 2.5, 230.0, BASE.minus(1, ChronoUnit.HOURS)));
    dao.writeMeterReading(new MeterReading("M-1", 3.0, 230.0, BASE));
    dao.writeMeterReading(new MeterReading("M-1", 100.0, 230.0, BASE.plusMillis(1)));
    dao.writeMeterReading(new MeterReading("M-2", 50.0, 230.0, BASE));

    MeterHistoryAggregate aggregate = dao.aggregateMeterHistory("M-1", from, BASE);

    assertThat(aggregate.getTotalKwhConsumedAc()).isEqualTo(7.0);
    assertThat(aggregate.getCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("Агрегат истории электромобиля: сумма DC, средняя температура, количество")
  void vehicleAggregateShouldSumAverageAndCount() {
    dao.writeVehicleReading(new VehicleReading("EV-1", 20.0, 10.0, 18.0, BASE.minus(2, ChronoUnit.HOURS)));
    dao.writeVehicleReading(new VehicleReading("EV-1", 40.0, 12.0, -3.0, BASE.minus(1, ChronoUnit.HOURS)));

    VehicleHistoryAggregate aggregate = dao.aggregateVehicleHistory("EV-1", BASE.minus(24, ChronoUnit.HOURS), BASE);

    assertThat(aggregate.getTotalKwhDeliveredDc()).isEqualTo(22.0);
    assertThat(aggregate.getAverageBatteryTemp()).isEqualTo(7.5);
    assertThat(aggregate.getCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("Пустое окно → нули, а не ошибка")
  void emptyWindowShouldYieldZeros() {
    VehicleHistoryAggregate vehicle = dao.aggregateVehicleHistory("EV-404", BASE.minus(24, ChronoUnit.HOURS), BASE);
    MeterHistoryAggregate meter = dao.aggregateMeterHistory("EV-404", BASE.minus(24, ChronoUnit.HOURS), BASE);

    assertThat(vehicle.getTotalKwhDeliveredDc()).isZero();
    assertThat(vehicle.getAverageBatteryTemp()).isZero();
    assertThat(vehicle.getCount()).isZero();
    assertThat(meter.getTotalKwhConsumedAc()).isZero();
    assertThat(meter.getCount()).isZero();
  }

  @Test
  @DisplayName("Параллельные записи одного устройства: в истории все, в состоянии одна из них целиком")
  void concurrentWritesForSameIdShouldNotMerge() throws Exception {
    int writers = 16;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < writers; i++) {
        double value = i;
        futures.add(pool.submit(() -> {
          start.await();
          dao.writeVehicleReading(new VehicleReading("EV-1", value, value, value, BASE.plusSeconds((long) value)));
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(countRows("vehicle_telemetry_history", "vehicleId", "EV-1")).isEqualTo(writers);
    VehicleLiveState state = dao.readVehicleLiveState("EV-1").orElseThrow();
    assertThat(state.getKwhDeliveredDc()).isEqualTo(state.getSoc());
    assertThat(state.getBatteryTemp()).isEqualTo(state.getSoc());
    assertThat(state.getLastUpdatedAt()).isEqualTo(BASE.plusSeconds((long) state.getSoc()));
  }

  @Test
  @DisplayName("Чтение живого состояния идёт по первичному ключу, а не по истории")
  void liveLookupShouldUsePrimaryKey() throws SQLException {
    seedHistory();

    String plan = explain(TelemetryDao.SELECT_VEHICLE_LIVE_STATE_SQL.replace("?", "'EV-3'"));

    assertThat(plan).contains("vehicle_live_state_pkey");
    assertThat(plan).doesNotContain("vehicle_telemetry_history");
  }

  @Test
  @DisplayName("Агрегация окна использует составной индекс (id, timestamp)")
  void windowAggregatesShouldUseCompositeIndex() throws SQLException {
    seedHistory();
    String from = "'2026-02-08T12:00:00Z'::timestamptz";
    String to = "'2026-02-09T12:00:00Z'::timestamptz";

    String meterPlan = explain(TelemetryDao.AGGREGATE_METER_HISTORY_SQL
        .replaceFirst("\\?", "'EV-3'").replaceFirst("\\?", from).replaceFirst("\\?", to));
    String vehiclePlan = explain(TelemetryDao.AGGREGATE_VEHICLE_HISTORY_SQL
        .replaceFirst("\\?", "'EV-3'").replaceFirst("\\?", from).replaceFirst("\\?", to));

    assertThat(meterPlan).contains("meter_telemetry_history_meterId_timestamp_idx");
    assertThat(vehiclePlan).contains("vehicle_telemetry_history_vehicleId_timestamp_idx");
  }

  private void seedHistory() throws SQLException {
    for (int device = 0; device < 10; device++) {
      for (int hour = 0; hour < 30; hour++) {
        Instant ts = BASE.minus(hour, ChronoUnit.HOURS);
        dao.writeMeterReading(new MeterReading("EV-" + device, hour, 230.0, ts));
        dao.writeVehicleReading(new VehicleReading("EV-" + device, 50.0, hour, 20.0, ts));
      }
    }
    try (Connection conn = database.getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute("ANALYZE");
    }
  }

  private String explain(String sql) throws SQLException {
    StringBuilder plan = new StringBuilder();
    try (Connection conn = database.getConnection();
         Statement stmt = conn.createStatement()) {
      // На маленьких таблицах планировщик иначе предпочтёт последовательное чтение
      stmt.execute("SET enable_seqscan = off");
      try (ResultSet rs = stmt.executeQuery("EXPLAIN " + sql)) {
        while (rs.next()) {
          plan.append(rs.getString(1)).append('\n');
        }
      }
    }
    return plan.toString();
  }

  private long countRows(String table, String idColumn, String id) throws SQLException {
    String sql = "SELECT COUNT(*) FROM " + table + " WHERE \"" + idColumn + "\" = ?";
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, id);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    }
  }

  private List<String> historySnapshot(String meterId) throws SQLException {
    List<String> rows = new ArrayList<>();
    String sql = """
        SELECT "id", "kwhConsumedAc", "voltage", "timestamp", "ingestedAt"
        FROM meter_telemetry_history WHERE "meterId" = ? ORDER BY "id"
        """;
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setString(1, meterId);
      try (ResultSet rs = pstmt.executeQuery()) {
        while (rs.next()) {
          rows.add(rs.getLong(1) + "|" + rs.getDouble(2) + "|" + rs.getDouble(3) + "|"
              + rs.getString(4) + "|" + rs.getString(5));
        }
      }
    }
    return rows;
  }
}
