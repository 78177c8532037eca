package com.energy.db;

import com.energy.model.MeterHistoryAggregate;
import com.energy.model.MeterLiveState;
import com.energy.model.MeterReading;
import com.energy.model.VehicleHistoryAggregate;
import com.energy.model.VehicleLiveState;
import com.energy.model.VehicleReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * DAO для таблиц живого состояния и истории телеметрии.
 * <p>
 * Каждое показание записывается одной транзакцией из двух операторов:
 * вставка в историю и upsert живого состояния. Либо видны обе записи, либо ни одной.
 */
public class TelemetryDao {

  private static final Logger logger = LoggerFactory.getLogger(TelemetryDao.class);

  static final String INSERT_METER_HISTORY_SQL = """
      INSERT INTO meter_telemetry_history ("meterId", "kwhConsumedAc", "voltage", "timestamp")
      VALUES (?, ?, ?, ?)
      """;

  static final String UPSERT_METER_LIVE_STATE_SQL = """
      INSERT INTO meter_live_state ("meterId", "kwhConsumedAc", "voltage", "lastUpdatedAt")
      VALUES (?, ?, ?, ?)
      ON CONFLICT ("meterId") DO UPDATE SET
          "kwhConsumedAc" = EXCLUDED."kwhConsumedAc",
          "voltage" = EXCLUDED."voltage",
          "lastUpdatedAt" = EXCLUDED."lastUpdatedAt"
      """;

  static final String INSERT_VEHICLE_HISTORY_SQL = """
      INSERT INTO vehicle_telemetry_history ("vehicleId", "soc", "kwhDeliveredDc", "batteryTemp", "timestamp")
      VALUES (?, ?, ?, ?, ?)
      """;

  static final String UPSERT_VEHICLE_LIVE_STATE_SQL = """
      INSERT INTO vehicle_live_state ("vehicleId", "soc", "kwhDeliveredDc", "batteryTemp", "lastUpdatedAt")
      VALUES (?, ?, ?, ?, ?)
      ON CONFLICT ("vehicleId") DO UPDATE SET
          "soc" = EXCLUDED."soc",
          "kwhDeliveredDc" = EXCLUDED."kwhDeliveredDc",
          "batteryTemp" = EXCLUDED."batteryTemp",
          "lastUpdatedAt" = EXCLUDED."lastUpdatedAt"
      """;

  static final String SELECT_METER_LIVE_STATE_SQL = """
      SELECT "meterId", "kwhConsumedAc", "voltage", "lastUpdatedAt"
      FROM meter_live_state WHERE "meterId" = ?
      """;

  static final String SELECT_VEHICLE_LIVE_STATE_SQL = """
      SELECT "vehicleId", "soc", "kwhDeliveredDc", "batteryTemp", "lastUpdatedAt"
      FROM vehicle_live_state WHERE "vehicleId" = ?
      """;

  // Фильтр по ("meterId", "timestamp") обслуживается составным индексом
  static final String AGGREGATE_METER_HISTORY_SQL = """
      SELECT COALESCE(SUM("kwhConsumedAc"), 0) AS total_ac, COUNT(*) AS points
      FROM meter_telemetry_history
      WHERE "meterId" = ? AND "timestamp" BETWEEN ? AND ?
      """;

  static final String AGGREGATE_VEHICLE_HISTORY_SQL = """
      SELECT COALESCE(SUM("kwhDeliveredDc"), 0) AS total_dc,
             COALESCE(AVG("batteryTemp"), 0) AS avg_temp,
             COUNT(*) AS points
      FROM vehicle_telemetry_history
      WHERE "vehicleId" = ? AND "timestamp" BETWEEN ? AND ?
      """;

  private final DatabaseConnection database;

  /**
   * @param database Дескриптор подключения к БД.
   */
  public TelemetryDao(DatabaseConnection database) {
    this.database = database;
  }

  /**
   * Атомарно сохраняет показание счётчика: строка истории + upsert живого состояния.
   *
   * @param reading Проверенное показание.
   * @throws StorageException если транзакция не выполнена; частичных записей не остаётся.
   */
  public void writeMeterReading(MeterReading reading) {
    try (Connection conn = database.getConnection()) {
      conn.setAutoCommit(false);
      try {
        insertMeterHistory(conn, reading);
        upsertMeterLiveState(conn, reading);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось сохранить показание счётчика. Счётчик: " + reading.getMeterId(), e);
    }
  }

  /**
   * Атомарно сохраняет телеметрию электромобиля: строка истории + upsert живого состояния.
   *
   * @param reading Проверенное показание.
   * @throws StorageException если транзакция не выполнена; частичных записей не остаётся.
   */
  public void writeVehicleReading(VehicleReading reading) {
    try (Connection conn = database.getConnection()) {
      conn.setAutoCommit(false);
      try {
        insertVehicleHistory(conn, reading);
        upsertVehicleLiveState(conn, reading);
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось сохранить телеметрию электромобиля. ТС: " + reading.getVehicleId(), e);
    }
  }

  /**
   * Читает живое состояние счётчика по первичному ключу. История не затрагивается.
   */
  public Optional<MeterLiveState> readMeterLiveState(String meterId) {
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(SELECT_METER_LIVE_STATE_SQL)) {
      pstmt.setString(1, meterId);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new MeterLiveState(
            rs.getString("meterId"),
            rs.getDouble("kwhConsumedAc"),
            rs.getDouble("voltage"),
            toInstant(rs, "lastUpdatedAt")
        ));
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать состояние счётчика " + meterId, e);
    }
  }

  /**
   * Читает живое состояние электромобиля по первичному ключу.
   */
  public Optional<VehicleLiveState> readVehicleLiveState(String vehicleId) {
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(SELECT_VEHICLE_LIVE_STATE_SQL)) {
      pstmt.setString(1, vehicleId);
      try (ResultSet rs = pstmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new VehicleLiveState(
            rs.getString("vehicleId"),
            rs.getDouble("soc"),
            rs.getDouble("kwhDeliveredDc"),
            rs.getDouble("batteryTemp"),
            toInstant(rs, "lastUpdatedAt")
        ));
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать состояние электромобиля " + vehicleId, e);
    }
  }

  /**
   * Сумма kwhConsumedAc и число строк истории счётчика в окне [from, to] включительно.
   */
  public MeterHistoryAggregate aggregateMeterHistory(String meterId, Instant from, Instant to) {
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(AGGREGATE_METER_HISTORY_SQL)) {
      pstmt.setString(1, meterId);
      setTimestamp(pstmt, 2, from);
      setTimestamp(pstmt, 3, to);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return new MeterHistoryAggregate(rs.getDouble("total_ac"), rs.getLong("points"));
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось агрегировать историю счётчика " + meterId, e);
    }
  }

  /**
   * Сумма kwhDeliveredDc, среднее batteryTemp и число строк истории электромобиля
   * в окне [from, to] включительно.
   */
  public VehicleHistoryAggregate aggregateVehicleHistory(String vehicleId, Instant from, Instant to) {
    try (Connection conn = database.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(AGGREGATE_VEHICLE_HISTORY_SQL)) {
      pstmt.setString(1, vehicleId);
      setTimestamp(pstmt, 2, from);
      setTimestamp(pstmt, 3, to);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return new VehicleHistoryAggregate(
            rs.getDouble("total_dc"),
            rs.getDouble("avg_temp"),
            rs.getLong("points")
        );
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось агрегировать историю электромобиля " + vehicleId, e);
    }
  }

  protected void insertMeterHistory(Connection conn, MeterReading reading) throws SQLException {
    try (PreparedStatement pstmt = conn.prepareStatement(INSERT_METER_HISTORY_SQL)) {
      pstmt.setString(1, reading.getMeterId());
      pstmt.setDouble(2, reading.getKwhConsumedAc());
      pstmt.setDouble(3, reading.getVoltage());
      setTimestamp(pstmt, 4, reading.getTimestamp());
      pstmt.executeUpdate();
    }
  }

  protected void upsertMeterLiveState(Connection conn, MeterReading reading) throws SQLException {
    try (PreparedStatement pstmt = conn.prepareStatement(UPSERT_METER_LIVE_STATE_SQL)) {
      pstmt.setString(1, reading.getMeterId());
      pstmt.setDouble(2, reading.getKwhConsumedAc());
      pstmt.setDouble(3, reading.getVoltage());
      setTimestamp(pstmt, 4, reading.getTimestamp());
      pstmt.executeUpdate();
    }
  }

  protected void insertVehicleHistory(Connection conn, VehicleReading reading) throws SQLException {
    try (PreparedStatement pstmt = conn.prepareStatement(INSERT_VEHICLE_HISTORY_SQL)) {
      pstmt.setString(1, reading.getVehicleId());
      pstmt.setDouble(2, reading.getSoc());
      pstmt.setDouble(3, reading.getKwhDeliveredDc());
      pstmt.setDouble(4, reading.getBatteryTemp());
      setTimestamp(pstmt, 5, reading.getTimestamp());
      pstmt.executeUpdate();
    }
  }

  protected void upsertVehicleLiveState(Connection conn, VehicleReading reading) throws SQLException {
    try (PreparedStatement pstmt = conn.prepareStatement(UPSERT_VEHICLE_LIVE_STATE_SQL)) {
      pstmt.setString(1, reading.getVehicleId());
      pstmt.setDouble(2, reading.getSoc());
      pstmt.setDouble(3, reading.getKwhDeliveredDc());
      pstmt.setDouble(4, reading.getBatteryTemp());
      setTimestamp(pstmt, 5, reading.getTimestamp());
      pstmt.executeUpdate();
    }
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackError) {
      // Соединение всё равно закрывается, незафиксированная транзакция будет отброшена сервером
      logger.warn("Откат транзакции не удался", rollbackError);
      cause.addSuppressed(rollbackError);
    }
  }

  private static void setTimestamp(PreparedStatement pstmt, int index, Instant value) throws SQLException {
    if (value == null) {
      pstmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
    } else {
      pstmt.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
    }
  }

  private static Instant toInstant(ResultSet rs, String column) throws SQLException {
    OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
    return value != null ? value.toInstant() : null;
  }
}
