package com.gentoro.slotfill.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends SlotFillException {
  public StateException(String message) {
    super(SlotFillErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(SlotFillErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
