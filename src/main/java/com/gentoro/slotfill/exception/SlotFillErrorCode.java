package com.gentoro.slotfill.exception;

/**
 * Canonical error codes for the slot extractor. Codes are stable and safe to surface to callers
 * and logs.
 */
public enum SlotFillErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Model lifecycle
  TRAINING_ERROR,
  INFERENCE_ERROR,
}
