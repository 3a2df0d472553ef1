package com.gentoro.slotfill.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * One resolved slot instance.
 *
 * @param name slot name
 * @param value normalized entity value, or the surface text of the tagged tokens
 * @param entity backing entity, {@code null} when the value comes from surface text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Slot(String name, Object value, Entity entity) {
  public Slot {
    Objects.requireNonNull(name, "name");
  }

  public Slot(String name, Object value) {
    this(name, value, null);
  }

  /** Copy of this slot with another value, keeping the backing entity. */
  public Slot withValue(Object newValue) {
    return new Slot(name, newValue, entity);
  }
}
