package com.gentoro.slotfill.model;

import java.util.List;
import java.util.Objects;

/** Ordered tokens of one utterance together with the intent it was expressed under. */
public record Sequence(List<Token> tokens, String intent) {

  public Sequence {
    Objects.requireNonNull(intent, "intent");
    tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    for (int i = 1; i < tokens.size(); i++) {
      Token previous = tokens.get(i - 1);
      Token current = tokens.get(i);
      if (current.start() < previous.end()) {
        throw new IllegalArgumentException(
            "Token '%s' at %d overlaps or precedes token '%s' ending at %d"
                .formatted(current.value(), current.start(), previous.value(), previous.end()));
      }
    }
  }

  public int size() {
    return tokens.size();
  }

  /** Composite labels of every token, in order. */
  public List<String> labels() {
    return tokens.stream().map(Token::label).toList();
  }
}
