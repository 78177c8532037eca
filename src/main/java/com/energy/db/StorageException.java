package com.energy.db;

/**
 * Ошибка хранилища: нарушение ограничения, потеря соединения, конфликт сериализации.
 * Транзакция, в которой она возникла, откатывается целиком.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
