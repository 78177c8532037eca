package com.energy.server;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Проверка JSON-тела одиночного показания до его десериализации.
 * <p>
 * Все нарушения собираются в одно {@link ValidationException}.
 */
public class RequestValidator {

  /**
   * Показание счётчика: meterId — непустая строка, kwhConsumedAc и voltage ≥ 0,
   * timestamp — абсолютный момент в формате ISO-8601.
   */
  public void validateMeter(JsonNode body) {
    List<String> errors = new ArrayList<>();
    requireObject(body);
    requireText(body, "meterId", errors);
    requireNumber(body, "kwhConsumedAc", 0.0, null, errors);
    requireNumber(body, "voltage", 0.0, null, errors);
    requireTimestamp(body, "timestamp", errors);
    throwIfAny(errors);
  }

  /**
   * Телеметрия электромобиля: vehicleId — непустая строка, soc в [0, 100],
   * kwhDeliveredDc ≥ 0, batteryTemp — любое число, timestamp в формате ISO-8601.
   */
  public void validateVehicle(JsonNode body) {
    List<String> errors = new ArrayList<>();
    requireObject(body);
    requireText(body, "vehicleId", errors);
    requireNumber(body, "soc", 0.0, 100.0, errors);
    requireNumber(body, "kwhDeliveredDc", 0.0, null, errors);
    requireNumber(body, "batteryTemp", null, null, errors);
    requireTimestamp(body, "timestamp", errors);
    throwIfAny(errors);
  }

  /**
   * Пакет должен быть JSON-массивом; элементы проверяются по одному обработчиком.
   */
  public void validateBatch(JsonNode body) {
    if (body == null || !body.isArray()) {
      throw new ValidationException("request body must be an array");
    }
  }

  private static void requireObject(JsonNode body) {
    if (body == null || !body.isObject()) {
      throw new ValidationException("request body must be an object");
    }
  }

  private static void requireText(JsonNode body, String field, List<String> errors) {
    JsonNode value = body.get(field);
    if (value == null || !value.isTextual()) {
      errors.add(field + " must be a string");
    } else if (value.asText().trim().isEmpty()) {
      errors.add(field + " must not be empty");
    }
  }

  private static void requireNumber(JsonNode body, String field, Double min, Double max, List<String> errors) {
    JsonNode value = body.get(field);
    if (value == null || !value.isNumber()) {
      errors.add(field + " must be a number");
      return;
    }
    double number = value.asDouble();
    if (!Double.isFinite(number)) {
      errors.add(field + " must be a finite number");
    } else if (min != null && number < min) {
      errors.add(field + " must not be less than " + format(min));
    } else if (max != null && number > max) {
      errors.add(field + " must not be greater than " + format(max));
    }
  }

  private static void requireTimestamp(JsonNode body, String field, List<String> errors) {
    JsonNode value = body.get(field);
    if (value == null || !value.isTextual()) {
      errors.add(field + " must be a valid ISO 8601 date string");
      return;
    }
    try {
      Instant.parse(value.asText());
    } catch (DateTimeParseException e) {
      errors.add(field + " must be a valid ISO 8601 date string");
    }
  }

  private static void throwIfAny(List<String> errors) {
    if (!errors.isEmpty()) {
      throw new ValidationException(errors);
    }
  }

  private static String format(double bound) {
    return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
  }
}
