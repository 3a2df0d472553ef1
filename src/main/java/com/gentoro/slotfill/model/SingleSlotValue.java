package com.gentoro.slotfill.model;

import java.util.List;
import java.util.Objects;

public record SingleSlotValue(Slot slot) implements SlotValue {
  public SingleSlotValue {
    Objects.requireNonNull(slot, "slot");
  }

  @Override
  public List<Slot> slots() {
    return List.of(slot);
  }

  @Override
  public boolean isMultiple() {
    return false;
  }

  @Override
  public SlotValue replaceLast(Slot replacement) {
    return new SingleSlotValue(replacement);
  }

  @Override
  public MultiSlotValue append(Slot next) {
    return new MultiSlotValue(List.of(slot, next));
  }

  @Override
  public Object toJsonShape() {
    return slot;
  }
}
