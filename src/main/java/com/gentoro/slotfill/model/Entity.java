package com.gentoro.slotfill.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Entity recognized by the external entity engine over character offsets of the raw utterance.
 *
 * @param name entity type (e.g. {@code artist}, {@code system.time})
 * @param meta character span, {@code end} exclusive
 * @param data normalized value
 */
public record Entity(String name, Meta meta, Data data) {

  @JsonCreator
  public Entity(
      @JsonProperty("name") String name,
      @JsonProperty("meta") Meta meta,
      @JsonProperty("data") Data data) {
    this.name = Objects.requireNonNull(name, "name");
    this.meta = Objects.requireNonNull(meta, "meta");
    this.data = data == null ? new Data(null) : data;
  }

  public static Entity of(String name, int start, int end, Object value) {
    return new Entity(name, new Meta(start, end), new Data(value));
  }

  /** True when this entity's span fully covers {@code [start, end)}. */
  public boolean covers(int start, int end) {
    return meta.start() <= start && meta.end() >= end;
  }

  public record Meta(int start, int end) {
    @JsonCreator
    public Meta(@JsonProperty("start") int start, @JsonProperty("end") int end) {
      this.start = start;
      this.end = end;
    }
  }

  public record Data(Object value) {
    @JsonCreator
    public Data(@JsonProperty("value") Object value) {
      this.value = value;
    }
  }
}
