package com.gentoro.slotfill.exception;

/** Configuration problem detected while building an extractor. */
public class ConfigException extends SlotFillException {
  public ConfigException(String message) {
    super(SlotFillErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SlotFillErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
