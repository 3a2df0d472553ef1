package com.gentoro.slotfill.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Two or more slots sharing a name, produced by disjoint {@code B-} spans. */
public record MultiSlotValue(List<Slot> slots) implements SlotValue {
  public MultiSlotValue {
    slots = List.copyOf(Objects.requireNonNull(slots, "slots"));
    if (slots.size() < 2) {
      throw new IllegalArgumentException("A multi-valued slot holds at least two slots");
    }
  }

  @Override
  public boolean isMultiple() {
    return true;
  }

  @Override
  public SlotValue replaceLast(Slot replacement) {
    List<Slot> copy = new ArrayList<>(slots);
    copy.set(copy.size() - 1, replacement);
    return new MultiSlotValue(copy);
  }

  @Override
  public MultiSlotValue append(Slot next) {
    List<Slot> copy = new ArrayList<>(slots);
    copy.add(next);
    return new MultiSlotValue(copy);
  }

  @Override
  public Object toJsonShape() {
    return slots;
  }
}
