package com.gentoro.slotfill.progress;

import java.util.Map;

/** No-op implementation used when progress reporting is disabled. */
public class NoOpProgressSink implements ProgressSink {
  public static final NoOpProgressSink INSTANCE = new NoOpProgressSink();

  @Override
  public void beginStage(String id, String label, long totalWork) {}

  @Override
  public void step(String id, long completed, String message) {}

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {}

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {}
}
