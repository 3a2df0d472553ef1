package com.gentoro.slotfill.exception;

import java.util.Map;

/** One of the training stages (embeddings, clustering, CRF) could not complete. */
public class TrainingException extends SlotFillException {
  public TrainingException(String message) {
    super(SlotFillErrorCode.TRAINING_ERROR, message);
  }

  public TrainingException(String message, Throwable cause) {
    super(SlotFillErrorCode.TRAINING_ERROR, message, cause);
  }

  public TrainingException(String message, Map<String, ?> context) {
    super(SlotFillErrorCode.TRAINING_ERROR, message, context);
  }
}
