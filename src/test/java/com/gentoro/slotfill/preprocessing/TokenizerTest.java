package com.gentoro.slotfill.preprocessing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TokenizerTest {

  @Test
  void splitsWordsAndPunctuationWithOffsets() {
    List<TokenSpan> spans = Tokenizer.tokenize("Play don't stop, now!");
    assertEquals(
        List.of("Play", "don't", "stop", ",", "now", "!"),
        spans.stream().map(TokenSpan::value).toList());
    assertEquals(new TokenSpan("don't", 5, 10), spans.get(1));
    assertEquals(new TokenSpan("!", 20, 21), spans.get(5));
  }

  @Test
  void keepsHyphenatedWordsTogether() {
    assertEquals(
        List.of("hip-hop", "99"),
        Tokenizer.tokenize("hip-hop 99").stream().map(TokenSpan::value).toList());
  }

  @Test
  void emptyInputs() {
    assertTrue(Tokenizer.tokenize("").isEmpty());
    assertTrue(Tokenizer.tokenize(null).isEmpty());
    assertTrue(Tokenizer.tokenize("   ").isEmpty());
  }

  @Test
  void regionKeepsAbsoluteOffsets() {
    List<TokenSpan> spans = Tokenizer.tokenize("play Kanye West", 5, 15);
    assertEquals(List.of(new TokenSpan("Kanye", 5, 10), new TokenSpan("West", 11, 15)), spans);
  }
}
