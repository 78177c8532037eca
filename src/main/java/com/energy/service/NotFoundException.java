package com.energy.service;

/**
 * Для идентификатора нет строки живого состояния.
 * Наличие строк в истории не делает устройство известным.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
