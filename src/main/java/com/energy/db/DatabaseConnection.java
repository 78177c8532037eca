package com.energy.db;

import com.energy.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Дескриптор подключения к PostgreSQL и инициализация схемы.
 * <p>
 * Создаётся явно и передаётся в DAO при конструировании.
 */
public class DatabaseConnection {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  private static final String CREATE_SCHEMA_SQL = """
      CREATE TABLE IF NOT EXISTS meter_live_state (
          "meterId" VARCHAR(50) NOT NULL CHECK ("meterId" <> ''),
          "kwhConsumedAc" DOUBLE PRECISION NOT NULL CHECK ("kwhConsumedAc" >= 0),
          "voltage" DOUBLE PRECISION NOT NULL CHECK ("voltage" >= 0),
          "lastUpdatedAt" TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP,
          CONSTRAINT "meter_live_state_pkey" PRIMARY KEY ("meterId")
      );

      CREATE TABLE IF NOT EXISTS vehicle_live_state (
          "vehicleId" VARCHAR(50) NOT NULL CHECK ("vehicleId" <> ''),
          "soc" DOUBLE PRECISION NOT NULL CHECK ("soc" BETWEEN 0 AND 100),
          "kwhDeliveredDc" DOUBLE PRECISION NOT NULL CHECK ("kwhDeliveredDc" >= 0),
          "batteryTemp" DOUBLE PRECISION NOT NULL,
          "lastUpdatedAt" TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP,
          CONSTRAINT "vehicle_live_state_pkey" PRIMARY KEY ("vehicleId")
      );

      CREATE TABLE IF NOT EXISTS meter_telemetry_history (
          "id" BIGSERIAL NOT NULL,
          "meterId" VARCHAR(50) NOT NULL CHECK ("meterId" <> ''),
          "kwhConsumedAc" DOUBLE PRECISION NOT NULL CHECK ("kwhConsumedAc" >= 0),
          "voltage" DOUBLE PRECISION NOT NULL CHECK ("voltage" >= 0),
          "timestamp" TIMESTAMPTZ NOT NULL,
          "ingestedAt" TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP,
          CONSTRAINT "meter_telemetry_history_pkey" PRIMARY KEY ("id")
      );

      CREATE TABLE IF NOT EXISTS vehicle_telemetry_history (
          "id" BIGSERIAL NOT NULL,
          "vehicleId" VARCHAR(50) NOT NULL CHECK ("vehicleId" <> ''),
          "soc" DOUBLE PRECISION NOT NULL CHECK ("soc" BETWEEN 0 AND 100),
          "kwhDeliveredDc" DOUBLE PRECISION NOT NULL CHECK ("kwhDeliveredDc" >= 0),
          "batteryTemp" DOUBLE PRECISION NOT NULL,
          "timestamp" TIMESTAMPTZ NOT NULL,
          "ingestedAt" TIMESTAMPTZ NOT NULL DEFAULT CURRENT_TIMESTAMP,
          CONSTRAINT "vehicle_telemetry_history_pkey" PRIMARY KEY ("id")
      );

      CREATE INDEX IF NOT EXISTS "meter_live_state_lastUpdatedAt_idx"
          ON meter_live_state ("lastUpdatedAt");
      CREATE INDEX IF NOT EXISTS "vehicle_live_state_lastUpdatedAt_idx"
          ON vehicle_live_state ("lastUpdatedAt");
      CREATE INDEX IF NOT EXISTS "meter_telemetry_history_meterId_timestamp_idx"
          ON meter_telemetry_history ("meterId", "timestamp");
      CREATE INDEX IF NOT EXISTS "meter_telemetry_history_timestamp_idx"
          ON meter_telemetry_history ("timestamp");
      CREATE INDEX IF NOT EXISTS "vehicle_telemetry_history_vehicleId_timestamp_idx"
          ON vehicle_telemetry_history ("vehicleId", "timestamp");
      CREATE INDEX IF NOT EXISTS "vehicle_telemetry_history_timestamp_idx"
          ON vehicle_telemetry_history ("timestamp");
      """;

  private final String url;
  private final String user;
  private final String password;

  /**
   * @param url JDBC URL базы данных.
   * @param user Имя пользователя.
   * @param password Пароль (может быть пустым, но не null).
   */
  public DatabaseConnection(String url, String user, String password) {
    if (url == null || url.trim().isEmpty()) {
      throw new IllegalArgumentException("Параметр 'db.url' не задан");
    }
    if (user == null || user.trim().isEmpty()) {
      throw new IllegalArgumentException("Параметр 'db.user' не задан");
    }
    if (password == null) {
      throw new IllegalArgumentException("Параметр 'db.password' не задан");
    }
    this.url = url;
    this.user = user;
    this.password = password;
  }

  /**
   * Создаёт дескриптор по параметрам db.url, db.user, db.password из {@link Config}.
   */
  public static DatabaseConnection fromConfig() {
    return new DatabaseConnection(
        Config.getRequiredProperty("db.url"),
        Config.getRequiredProperty("db.user"),
        Config.getProperty("db.password", "")
    );
  }

  /**
   * Открывает новое соединение с базой данных. Закрывает его вызывающий код.
   *
   * @return Новое соединение с PostgreSQL.
   * @throws StorageException если подключение не удалось.
   */
  public Connection getConnection() {
    try {
      Connection conn = DriverManager.getConnection(url, user, password);
      logger.debug("Подключение к БД {} открыто", url);
      return conn;
    } catch (SQLException e) {
      throw new StorageException(
          "Не удалось подключиться к базе данных по адресу: " + url +
              ". Проверьте, что PostgreSQL запущен и параметры подключения верны.",
          e
      );
    }
  }

  /**
   * Создаёт таблицы живого состояния и истории вместе с индексами, если их ещё нет.
   * Вызывается при старте приложения.
   *
   * @throws StorageException если не удалось создать схему.
   */
  public void initializeDatabase() {
    try (Connection conn = getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute(CREATE_SCHEMA_SQL);
      logger.info("✅ Схема телеметрии создана или уже существует.");
    } catch (SQLException e) {
      throw new StorageException("Не удалось инициализировать схему базы данных.", e);
    }
  }
}
