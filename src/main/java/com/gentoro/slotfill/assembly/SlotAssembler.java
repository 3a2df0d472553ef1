package com.gentoro.slotfill.assembly;

import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.model.BIO;
import com.gentoro.slotfill.model.Entity;
import com.gentoro.slotfill.model.IntentDefinition;
import com.gentoro.slotfill.model.SingleSlotValue;
import com.gentoro.slotfill.model.Slot;
import com.gentoro.slotfill.model.SlotCollection;
import com.gentoro.slotfill.model.SlotDefinition;
import com.gentoro.slotfill.model.SlotValue;
import com.gentoro.slotfill.model.Token;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds structured slots from a token-level tag sequence.
 *
 * <p>Tokens and tags are paired by position and the longer list is truncated. Outside tags and
 * slot names the intent does not declare are skipped. An {@code I-} tag extends the last slot of
 * the same name; a {@code B-} tag for a name already present turns it into a multi-valued slot.
 */
public final class SlotAssembler {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SlotAssembler.class);

  private SlotAssembler() {}

  public static SlotCollection assemble(
      List<Token> tokens, List<String> tags, IntentDefinition intent, List<Entity> entities) {
    List<Entity> safeEntities = entities == null ? List.of() : entities;
    SlotCollection.Builder slots = SlotCollection.builder();

    int pairs = Math.min(tokens.size(), tags.size());
    for (int i = 0; i < pairs; i++) {
      Token token = tokens.get(i);
      String tag = tags.get(i);
      if (token == null || tag == null) continue;
      BIO bio = BIO.fromLabel(tag);
      if (bio == BIO.OUT) continue;

      String slotName = tag.substring(Math.min(2, tag.length()));
      Optional<SlotDefinition> definition = intent.slot(slotName);
      if (definition.isEmpty()) {
        log.debug("Dropping tag '{}': slot not declared on intent '{}'", tag, intent.name());
        continue;
      }

      Optional<SlotValue> existing = slots.get(slotName);
      Slot slot = makeSlot(slotName, token, definition.get(), safeEntities);
      if (bio == BIO.INSIDE && existing.isPresent()) {
        SlotValue value = existing.get();
        slots.put(slotName, value.replaceLast(extend(value.last(), token)));
      } else if (bio == BIO.BEGINNING && existing.isPresent()) {
        slots.put(slotName, existing.get().append(slot));
      } else {
        slots.put(slotName, new SingleSlotValue(slot));
      }
    }
    return slots.build();
  }

  static Slot makeSlot(
      String slotName, Token token, SlotDefinition definition, List<Entity> entities) {
    Optional<Entity> entity = coveringEntity(token, definition, entities);
    if (entity.isPresent()) {
      Object value = entity.get().data().value();
      return new Slot(slotName, value == null ? token.value() : value, entity.get());
    }
    return new Slot(slotName, token.value());
  }

  private static Optional<Entity> coveringEntity(
      Token token, SlotDefinition definition, List<Entity> entities) {
    if (definition.entity() == null) return Optional.empty();
    return entities.stream()
        .filter(e -> definition.entity().equals(e.name()))
        .filter(e -> e.covers(token.start(), token.end()))
        .findFirst();
  }

  /** Appends the token's surface text unless the slot's entity already spans the token. */
  private static Slot extend(Slot slot, Token token) {
    if (slot.entity() != null && slot.entity().covers(token.start(), token.end())) {
      return slot;
    }
    return slot.withValue(slot.value() + " " + token.value());
  }
}
