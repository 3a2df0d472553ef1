package com.gentoro.slotfill.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Slots extracted from one utterance, keyed by slot name in order of first occurrence.
 *
 * <p>Instances are immutable; build them with {@link Builder}.
 */
public final class SlotCollection {
  private static final SlotCollection EMPTY = new SlotCollection(Map.of());

  private final Map<String, SlotValue> values;

  private SlotCollection(Map<String, SlotValue> values) {
    this.values = values;
  }

  public static SlotCollection empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<SlotValue> get(String slotName) {
    return Optional.ofNullable(values.get(slotName));
  }

  public Set<String> names() {
    return values.keySet();
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<String, SlotValue> asMap() {
    return values;
  }

  /** Shape consumed by dialog management: {@code name -> Slot} or {@code name -> [Slot, ...]}. */
  @JsonValue
  public Map<String, Object> toJsonShape() {
    Map<String, Object> shape = new LinkedHashMap<>();
    values.forEach((name, value) -> shape.put(name, value.toJsonShape()));
    return shape;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SlotCollection other)) return false;
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "SlotCollection" + values;
  }

  /** Mutable accumulator used while assembling slots; not thread-safe. */
  public static final class Builder {
    private final Map<String, SlotValue> values = new LinkedHashMap<>();

    private Builder() {}

    public Optional<SlotValue> get(String slotName) {
      return Optional.ofNullable(values.get(slotName));
    }

    public Builder put(String slotName, SlotValue value) {
      values.put(slotName, value);
      return this;
    }

    public SlotCollection build() {
      if (values.isEmpty()) return EMPTY;
      return new SlotCollection(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }
  }
}
