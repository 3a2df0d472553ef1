package com.gentoro.slotfill.exception;

/** The tagging backend failed while labelling a sequence. */
public class InferenceException extends SlotFillException {
  public InferenceException(String message) {
    super(SlotFillErrorCode.INFERENCE_ERROR, message);
  }

  public InferenceException(String message, Throwable cause) {
    super(SlotFillErrorCode.INFERENCE_ERROR, message, cause);
  }
}
