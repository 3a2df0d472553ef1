package com.gentoro.slotfill.exception;

/** Inference was requested before training completed successfully. */
public class NotTrainedException extends StateException {
  public NotTrainedException() {
    super("Model not trained, please call train() before");
  }
}
