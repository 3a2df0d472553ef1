package com.gentoro.slotfill.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Slot declared on an intent.
 *
 * @param name slot name as it appears in labels ({@code B-<name>})
 * @param entity entity type whose recognized values fill this slot
 */
public record SlotDefinition(String name, String entity) {
  @JsonCreator
  public SlotDefinition(@JsonProperty("name") String name, @JsonProperty("entity") String entity) {
    this.name = Objects.requireNonNull(name, "name");
    this.entity = entity;
  }
}
