package com.gentoro.slotfill.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BIOTest {

  @Test
  @DisplayName("Composite labels use o, B-<slot> and I-<slot>")
  void labels() {
    assertEquals("o", BIO.OUT.label("artist"));
    assertEquals("B-artist", BIO.BEGINNING.label("artist"));
    assertEquals("I-artist", BIO.INSIDE.label("artist"));
  }

  @Test
  void parsesLabels() {
    assertEquals(BIO.BEGINNING, BIO.fromLabel("B-song"));
    assertEquals(BIO.INSIDE, BIO.fromLabel("I-song"));
    assertEquals(BIO.OUT, BIO.fromLabel("o"));
    assertEquals(BIO.OUT, BIO.fromLabel(null));
    assertEquals("song", BIO.slotOf("I-song"));
    assertNull(BIO.slotOf("o"));
  }

  @Test
  @DisplayName("Outside tokens never carry a slot, tagged tokens always do")
  void tokenSlotInvariant() {
    Token outside = new Token("play", 0, 4, BIO.OUT, "song", Set.of());
    assertNull(outside.slot());
    assertEquals("o", outside.label());

    assertThrows(
        IllegalArgumentException.class, () -> new Token("x", 0, 1, BIO.BEGINNING, null, null));
    assertThrows(IllegalArgumentException.class, () -> new Token("x", 3, 1, BIO.OUT, null, null));
  }

  @Test
  void sequenceRejectsOverlappingTokens() {
    Token a = Token.outside("hello", 0, 5, Set.of());
    Token b = Token.outside("lo", 3, 5, Set.of());
    assertThrows(IllegalArgumentException.class, () -> new Sequence(List.of(a, b), "i"));
  }
}
