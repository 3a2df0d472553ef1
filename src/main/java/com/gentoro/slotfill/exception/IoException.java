package com.gentoro.slotfill.exception;

/** I/O operation failed (work directory, corpus or model files). */
public class IoException extends SlotFillException {
  public IoException(String message) {
    super(SlotFillErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(SlotFillErrorCode.IO_ERROR, message, cause);
  }
}
