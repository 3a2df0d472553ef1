package com.gentoro.slotfill.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One token of an utterance with its character span ({@code end} exclusive), its gold or
 * predicted BIO tag, the slot it belongs to and the names of entities covering it.
 */
public record Token(
    String value, int start, int end, BIO tag, String slot, Set<String> matchedEntities) {

  public Token {
    Objects.requireNonNull(value, "value");
    if (start < 0 || end < start) {
      throw new IllegalArgumentException(
          "Invalid token span [%d, %d) for '%s'".formatted(start, end, value));
    }
    tag = tag == null ? BIO.OUT : tag;
    if (tag == BIO.OUT) {
      slot = null;
    } else if (slot == null || slot.isBlank()) {
      throw new IllegalArgumentException(
          "Tag " + tag + " requires a slot name for '" + value + "'");
    }
    SortedSet<String> entities = new TreeSet<>();
    if (matchedEntities != null) entities.addAll(matchedEntities);
    matchedEntities = Collections.unmodifiableSortedSet(entities);
  }

  /** Untagged token (used for prediction sequences). */
  public static Token outside(String value, int start, int end, Set<String> matchedEntities) {
    return new Token(value, start, end, BIO.OUT, null, matchedEntities);
  }

  /** Composite training label of this token, see {@link BIO#label(String)}. */
  public String label() {
    return tag.label(slot);
  }
}
