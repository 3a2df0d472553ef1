package com.gentoro.slotfill.embedding;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.slotfill.exception.ConfigException;
import org.junit.jupiter.api.Test;

class EmbeddingParamsTest {

  @Test
  void defaults() {
    EmbeddingParams p = EmbeddingParams.DEFAULTS;
    assertEquals("skipgram", p.method());
    assertEquals(2, p.minCount());
    assertEquals(25000, p.bucket());
    assertEquals(15, p.dim());
    assertEquals(0.5, p.learningRate());
    assertEquals(3, p.wordNgrams());
    assertEquals(2, p.minn());
    assertEquals(6, p.maxn());
    assertEquals(50, p.epoch());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(
        ConfigException.class, () -> new EmbeddingParams("glove", 2, 25000, 15, 0.5, 3, 2, 6, 50));
    assertThrows(
        ConfigException.class,
        () -> new EmbeddingParams("skipgram", 2, 25000, 0, 0.5, 3, 2, 6, 50));
    assertThrows(
        ConfigException.class, () -> new EmbeddingParams("cbow", 2, 25000, 15, 0.5, 3, 6, 2, 50));
  }
}
