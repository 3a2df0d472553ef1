package com.gentoro.slotfill.progress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

@ExtendWith(MockitoExtension.class)
class LoggingProgressSinkTest {

  @Mock Logger logger;

  @Test
  void payloadClampsAndComputesPercent() {
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 0);
    sink.beginStage("crf", "Training CRF tagger", 120);

    Map<String, Object> payload = sink.createPayload("crf", 40, "step", Map.of(), "running");
    assertEquals("crf", payload.get("stageId"));
    assertEquals("Training CRF tagger", payload.get("label"));
    assertEquals(40L, payload.get("completed"));
    assertEquals(120L, payload.get("total"));
    assertEquals(33, payload.get("percent"));

    Map<String, Object> over = sink.createPayload("crf", 500, "step", null, "running");
    assertEquals(120L, over.get("completed"));
    assertEquals(100, over.get("percent"));
    assertEquals(Map.of(), over.get("attrs"));
  }

  @Test
  void unknownTotalReportsZeroPercent() {
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 0);
    Map<String, Object> payload = sink.createPayload("clusters", 7, "step", Map.of(), "running");
    assertEquals(0, payload.get("percent"));
    assertEquals("clusters", payload.get("label"));
  }

  @Test
  void stepsAreRateLimitedButStageEventsAreNot() {
    when(logger.isInfoEnabled()).thenReturn(true);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 60_000, 10);

    sink.beginStage("crf", "Training CRF tagger", 30);
    sink.step("crf", 1, "appended sequence");
    sink.step("crf", 2, "appended sequence");
    sink.step("crf", 11, "appended sequence");
    sink.endStageError("crf", "TrainingException: boom", Map.of("elapsedMs", 3L));

    ArgumentCaptor<Object> json = ArgumentCaptor.forClass(Object.class);
    verify(logger, times(4)).info(eq("[training.progress] {}"), json.capture());
    List<Object> lines = json.getAllValues();
    assertTrue(lines.get(0).toString().contains("\"message\":\"begin\""));
    assertTrue(lines.get(2).toString().contains("\"completed\":11"));
    assertTrue(lines.get(3).toString().contains("\"status\":\"error\""));
    assertTrue(lines.get(3).toString().contains("boom"));
  }

  @Test
  void nothingIsSerializedWhenInfoIsDisabled() {
    when(logger.isInfoEnabled()).thenReturn(false);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 0);

    sink.beginStage("embeddings", "Training word embeddings", 6);
    sink.endStageOk("embeddings", Map.of());

    verify(logger, never()).info(anyString(), any(Object.class));
  }
}
