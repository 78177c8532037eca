package com.energy.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Утилитарный класс для чтения конфигурации из application.properties.
 * <p>
 * Любой ключ можно переопределить системным свойством JVM (-Dkey=value),
 * системное свойство имеет приоритет над файлом.
 */
public final class Config {

  private static final Properties PROPS = new Properties();

  static {
    try (InputStream input = Config.class.getClassLoader()
        .getResourceAsStream("application.properties")) {
      if (input == null) {
        throw new IllegalStateException("Файл application.properties не найден в classpath.");
      }
      PROPS.load(input);
    } catch (IOException e) {
      throw new IllegalStateException("Не удалось загрузить application.properties", e);
    }
  }

  /**
   * Возвращает значение обязательного параметра.
   *
   * @param key Ключ параметра (например, "db.url").
   * @return Непустое строковое значение.
   * @throws IllegalStateException если параметр не задан или пуст.
   */
  public static String getRequiredProperty(String key) {
    String value = lookup(key);
    if (value == null || value.isEmpty()) {
      throw new IllegalStateException("Обязательный параметр '" + key + "' не задан ни в системных свойствах, ни в application.properties");
    }
    return value;
  }

  /**
   * Возвращает значение параметра или значение по умолчанию, если параметр не задан.
   * Пустая строка считается заданным значением (нужно, например, для пустого пароля БД).
   */
  public static String getProperty(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Возвращает целочисленный параметр.
   *
   * @throws IllegalStateException если значение не является целым числом.
   */
  public static int getIntProperty(String key, int defaultValue) {
    String value = lookup(key);
    if (value == null || value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть целым числом, получено: " + value, e);
    }
  }

  private static String lookup(String key) {
    // Сначала системное свойство
    String sysValue = System.getProperty(key);
    if (sysValue != null && !sysValue.trim().isEmpty()) {
      return sysValue.trim();
    }
    String propValue = PROPS.getProperty(key);
    return propValue != null ? propValue.trim() : null;
  }

  // Запрещаем создание экземпляров
  private Config() {
    throw new UnsupportedOperationException("Utility class");
  }
}
