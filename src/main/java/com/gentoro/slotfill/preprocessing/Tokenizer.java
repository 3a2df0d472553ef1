package com.gentoro.slotfill.preprocessing;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an utterance into word and punctuation tokens while keeping their character offsets.
 *
 * <p>A word is a run of letters or digits, optionally joined by a single inner apostrophe or
 * hyphen ({@code don't}, {@code hip-hop}). Every other non-space character becomes its own token.
 */
public final class Tokenizer {
  private static final Pattern TOKEN =
      Pattern.compile("[\\p{L}\\p{N}]+(?:['’\\-][\\p{L}\\p{N}]+)*|[^\\s\\p{L}\\p{N}]");

  private Tokenizer() {}

  public static List<TokenSpan> tokenize(String text) {
    if (text == null || text.isEmpty()) return List.of();
    return tokenize(text, 0, text.length());
  }

  /** Tokenizes {@code text[from, to)}; offsets stay relative to the whole text. */
  public static List<TokenSpan> tokenize(String text, int from, int to) {
    List<TokenSpan> out = new ArrayList<>();
    Matcher m = TOKEN.matcher(text).region(from, to);
    while (m.find()) {
      out.add(new TokenSpan(m.group(), m.start(), m.end()));
    }
    return out;
  }
}
