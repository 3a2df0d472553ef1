package com.gentoro.slotfill.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Intent name and the slots declared for it. */
public record IntentDefinition(String name, List<SlotDefinition> slots) {
  @JsonCreator
  public IntentDefinition(
      @JsonProperty("name") String name, @JsonProperty("slots") List<SlotDefinition> slots) {
    this.name = Objects.requireNonNull(name, "name");
    this.slots = slots == null ? List.of() : List.copyOf(slots);
  }

  public Optional<SlotDefinition> slot(String slotName) {
    return slots.stream().filter(s -> s.name().equals(slotName)).findFirst();
  }

  public boolean declares(String slotName) {
    return slot(slotName).isPresent();
  }
}
