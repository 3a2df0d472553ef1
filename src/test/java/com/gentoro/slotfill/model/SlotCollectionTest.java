package com.gentoro.slotfill.model;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.slotfill.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SlotCollectionTest {

  @Test
  @DisplayName("Single values serialize as objects, multiple values as arrays")
  void jsonShape() throws Exception {
    SlotCollection slots =
        SlotCollection.builder()
            .put("destination", new SingleSlotValue(new Slot("destination", "Paris")))
            .put(
                "song",
                new MultiSlotValue(List.of(new Slot("song", "Hello"), new Slot("song", "Hurt"))))
            .build();

    JsonNode json = JacksonUtility.getJsonMapper().readTree(JacksonUtility.toJson(slots));

    assertEquals("Paris", json.get("destination").get("value").asText());
    assertFalse(json.get("destination").has("entity"));
    assertTrue(json.get("song").isArray());
    assertEquals("Hurt", json.get("song").get(1).get("value").asText());
    assertEquals(List.of("destination", "song"), List.copyOf(slots.names()));
  }

  @Test
  void immutableAndEmpty() {
    SlotCollection slots =
        SlotCollection.builder().put("a", new SingleSlotValue(new Slot("a", "x"))).build();
    assertThrows(
        UnsupportedOperationException.class,
        () -> slots.asMap().put("b", new SingleSlotValue(new Slot("b", "y"))));
    assertSame(SlotCollection.empty(), SlotCollection.builder().build());
    assertTrue(SlotCollection.empty().isEmpty());
  }

  @Test
  void multiValueNeedsTwoSlots() {
    assertThrows(
        IllegalArgumentException.class, () -> new MultiSlotValue(List.of(new Slot("a", "x"))));
    SlotValue grown = new SingleSlotValue(new Slot("a", "x")).append(new Slot("a", "y"));
    assertTrue(grown.isMultiple());
    assertEquals("y", grown.last().value());
  }
}
