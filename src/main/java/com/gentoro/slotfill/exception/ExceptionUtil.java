package com.gentoro.slotfill.exception;

/** Utility helpers for dealing with exceptions in logs and progress events. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Short one-line summary of a throwable: simple class name, error code when available, and
   * message.
   */
  public static String summarize(Throwable t) {
    if (t == null) return "";
    StringBuilder sb = new StringBuilder(t.getClass().getSimpleName());
    if (t instanceof SlotFillException ex) {
      sb.append('[').append(ex.getCode()).append(']');
    }
    if (t.getMessage() != null) {
      sb.append(": ").append(t.getMessage());
    }
    return sb.toString();
  }

  /**
   * Produce a compact, human-friendly representation of a throwable's stack trace. It captures only
   * the top frames up to the provided limit and joins them in call-order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }
}
