package com.gentoro.slotfill.model;

import java.util.List;

/**
 * Value stored under a slot name in a {@link SlotCollection}: either exactly one {@link Slot}
 * ({@link SingleSlotValue}) or an ordered list of at least two ({@link MultiSlotValue}).
 */
public interface SlotValue {

  /** All slots held by this value, left to right. */
  List<Slot> slots();

  boolean isMultiple();

  /** Most recently added slot. */
  default Slot last() {
    List<Slot> all = slots();
    return all.get(all.size() - 1);
  }

  /** Value with its last slot replaced. */
  SlotValue replaceLast(Slot slot);

  /** Value with {@code slot} added after the existing ones; always multiple. */
  MultiSlotValue append(Slot slot);

  /** JSON shape: a single slot object or an array of slot objects. */
  Object toJsonShape();
}
