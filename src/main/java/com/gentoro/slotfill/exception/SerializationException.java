package com.gentoro.slotfill.exception;

/** JSON or YAML (de)serialization failed. */
public class SerializationException extends SlotFillException {
  public SerializationException(String message) {
    super(SlotFillErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(SlotFillErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
