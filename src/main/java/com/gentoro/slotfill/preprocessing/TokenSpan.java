package com.gentoro.slotfill.preprocessing;

/** Surface text of a token and its character span in the source text ({@code end} exclusive). */
public record TokenSpan(String value, int start, int end) {}
