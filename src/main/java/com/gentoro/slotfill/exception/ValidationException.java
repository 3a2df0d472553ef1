package com.gentoro.slotfill.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends SlotFillException {
  public ValidationException(String message) {
    super(SlotFillErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(SlotFillErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
