package com.gentoro.slotfill.model;

/** Begin / inside / outside sequence-labelling scheme. */
public enum BIO {
  OUT("o"),
  BEGINNING("B"),
  INSIDE("I");

  private final String code;

  BIO(String code) {
    this.code = code;
  }

  /** Single-character code used as the label prefix ({@code o}, {@code B}, {@code I}). */
  public String code() {
    return code;
  }

  /**
   * Composite CRF label for a tag and slot name: {@code o} when outside, {@code B-artist} or
   * {@code I-artist} otherwise.
   */
  public String label(String slot) {
    if (this == OUT || slot == null) return code;
    return code + "-" + slot;
  }

  /** Parses the BIO prefix of a composite label; unknown prefixes read as {@link #OUT}. */
  public static BIO fromLabel(String label) {
    if (label == null || label.isEmpty()) return OUT;
    char c = label.charAt(0);
    if (c == 'B') return BEGINNING;
    if (c == 'I') return INSIDE;
    return OUT;
  }

  /** Slot name carried by a composite label, or {@code null} for outside labels. */
  public static String slotOf(String label) {
    if (fromLabel(label) == OUT || label.length() <= 2) return null;
    return label.substring(2);
  }
}
