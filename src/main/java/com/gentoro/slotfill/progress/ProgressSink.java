package com.gentoro.slotfill.progress;

import java.util.Map;

/**
 * Progress reporting for the training pipeline.
 *
 * <p>Decouples the extractor (producer of stage events) from where the events end up. The stage
 * ids used by the extractor are {@code embeddings}, {@code clusters} and {@code crf}.
 * Implementations must be cheap and must not throw.
 */
public interface ProgressSink {

  /**
   * Signal the beginning of a stage.
   *
   * @param id stable stage identifier
   * @param label human-readable label
   * @param totalWork total work units, 0 when unknown
   */
  void beginStage(String id, String label, long totalWork);

  /** Report an incremental step within a stage. */
  void step(String id, long completed, String message);

  /** Mark a stage as successfully completed. */
  void endStageOk(String id, Map<String, Object> attrs);

  /** Mark a stage as failed with a short error summary. */
  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
