package com.gentoro.slotfill.progress;

import com.gentoro.slotfill.utility.JacksonUtility;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Progress sink that writes one JSON line per training event to the given logger.
 *
 * <p>Step events are rate-limited with {@link ProgressRateLimiter}; stage begin/end events are
 * always written. Each message has a stable shape:
 *
 * <pre>
 * {
 *   "stageId": "crf",
 *   "label": "Training CRF tagger",
 *   "completed": 40,
 *   "total": 120,
 *   "percent": 33,
 *   "message": "appended sequence",
 *   "attrs": { ... },
 *   "status": "running|ok|error"
 * }
 * </pre>
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final ProgressRateLimiter limiter;

  private final Map<String, Long> totals = new ConcurrentHashMap<>();
  private final Map<String, Long> completions = new ConcurrentHashMap<>();
  private final Map<String, String> labels = new ConcurrentHashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.limiter = new ProgressRateLimiter(minIntervalMs, minDelta);
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    completions.put(id, 0L);
    labels.put(id, label);
    limiter.reset();
    emit(id, 0L, "begin", Map.of(), "running");
  }

  @Override
  public void step(String id, long completed, String message) {
    if (limiter.tryAcquire(System.currentTimeMillis(), completed)) {
      completions.put(id, completed);
      emit(id, completed, message, Map.of(), "running");
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    long total = totals.getOrDefault(id, 0L);
    emit(id, Math.max(total, completions.getOrDefault(id, 0L)), "end", attrs, "ok");
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> merged = new HashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    emit(id, completions.getOrDefault(id, 0L), "error", merged, "error");
  }

  /** Build the payload map. */
  Map<String, Object> createPayload(
      String id, long completed, String message, Map<String, Object> attrs, String status) {
    long total = totals.getOrDefault(id, 0L);
    long safeCompleted = Math.max(0, total == 0 ? completed : Math.min(completed, total));
    int percent = total > 0 ? (int) Math.min(100, Math.round((safeCompleted * 100.0) / total)) : 0;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stageId", id);
    payload.put("label", labels.getOrDefault(id, id));
    payload.put("completed", safeCompleted);
    payload.put("total", total);
    payload.put("percent", percent);
    payload.put("message", message);
    payload.put("attrs", attrs == null ? Map.of() : attrs);
    payload.put("status", status);
    return payload;
  }

  private void emit(
      String id, long completed, String message, Map<String, Object> attrs, String status) {
    if (!log.isInfoEnabled()) return;
    Map<String, Object> payload = createPayload(id, completed, message, attrs, status);
    log.info("[training.progress] {}", JacksonUtility.toJson(payload));
  }
}
