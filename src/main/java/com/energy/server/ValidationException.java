package com.energy.server;

import java.util.List;

/**
 * Входные данные не прошли проверку типов, диапазонов или формы.
 * Возникает на границе HTTP, до обращения к сервисам.
 */
public class ValidationException extends RuntimeException {

  private final List<String> errors;

  public ValidationException(List<String> errors) {
    super(String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public ValidationException(String error) {
    this(List.of(error));
  }

  public List<String> getErrors() {
    return errors;
  }
}
