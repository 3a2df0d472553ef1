package com.gentoro.slotfill.assembly;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.slotfill.model.Entity;
import com.gentoro.slotfill.model.IntentDefinition;
import com.gentoro.slotfill.model.MultiSlotValue;
import com.gentoro.slotfill.model.SingleSlotValue;
import com.gentoro.slotfill.model.Slot;
import com.gentoro.slotfill.model.SlotCollection;
import com.gentoro.slotfill.model.SlotDefinition;
import com.gentoro.slotfill.model.Token;
import com.gentoro.slotfill.preprocessing.SequenceGenerator;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SlotAssemblerTest {

  private static final IntentDefinition TRAVEL =
      new IntentDefinition("book_flight", List.of(new SlotDefinition("destination", "city")));
  private static final IntentDefinition MUSIC =
      new IntentDefinition(
          "play_music",
          List.of(new SlotDefinition("artist", "artist"), new SlotDefinition("song", "song")));

  private static List<Token> tokens(String text, List<Entity> entities) {
    return SequenceGenerator.forPrediction(text, "any", entities).tokens();
  }

  @Test
  void singleTokenSlot() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("fly to Paris", List.of()), List.of("o", "o", "B-destination"), TRAVEL, null);

    assertEquals(1, slots.size());
    assertEquals(
        new SingleSlotValue(new Slot("destination", "Paris")), slots.get("destination").get());
  }

  @Test
  void lastTokenSlot() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("book a flight", List.of()), List.of("o", "o", "B-destination"), TRAVEL, null);

    assertEquals(
        new SingleSlotValue(new Slot("destination", "flight")), slots.get("destination").get());
  }

  @Test
  @DisplayName("I- tags extend the open slot with the token's surface text")
  void multiTokenSlot() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("play Kanye West", List.of()),
            List.of("o", "B-artist", "I-artist"),
            MUSIC,
            List.of());

    assertEquals("Kanye West", slots.get("artist").get().last().value());
    assertFalse(slots.get("artist").get().isMultiple());
  }

  @Test
  @DisplayName("A second B- tag for the same slot makes it multi-valued, in order")
  void repeatedSlotBecomesMultiple() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("play Hello and Hurt", List.of()),
            List.of("o", "B-song", "o", "B-song"),
            MUSIC,
            List.of());

    assertEquals(
        new MultiSlotValue(List.of(new Slot("song", "Hello"), new Slot("song", "Hurt"))),
        slots.get("song").get());
  }

  @Test
  void insideTagExtendsLastValueOfMultiSlot() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("play Hello and Hey Jude", List.of()),
            List.of("o", "B-song", "o", "B-song", "I-song"),
            MUSIC,
            List.of());

    List<Slot> songs = slots.get("song").get().slots();
    assertEquals(List.of("Hello", "Hey Jude"), songs.stream().map(Slot::value).toList());
  }

  @Test
  void insideWithoutBeginningStartsASlot() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("play Jude", List.of()), List.of("o", "I-song"), MUSIC, List.of());
    assertEquals("Jude", slots.get("song").get().last().value());
  }

  @Test
  @DisplayName("Covering entity of the slot's type supplies the value and is attached")
  void entityBackedValue() {
    Entity kanye = Entity.of("artist", 5, 15, "kanye_west");
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("play Kanye West", List.of(kanye)),
            List.of("o", "B-artist", "I-artist"),
            MUSIC,
            List.of(kanye));

    Slot artist = slots.get("artist").get().last();
    assertEquals("kanye_west", artist.value());
    assertSame(kanye, artist.entity());
  }

  @Test
  void entityOfAnotherTypeIsIgnored() {
    Entity city = Entity.of("city", 5, 10, "paris");
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("play Paris", List.of(city)), List.of("o", "B-song"), MUSIC, List.of(city));

    Slot song = slots.get("song").get().last();
    assertEquals("Paris", song.value());
    assertNull(song.entity());
  }

  @Test
  void undeclaredSlotsAndOutsideTagsAreDropped() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("fly to Paris", List.of()), List.of("B-verb", "o", "B-city"), TRAVEL, List.of());
    assertTrue(slots.isEmpty());
  }

  @Test
  @DisplayName("Tokens and tags are paired up to the shorter list")
  void truncatesToShorterList() {
    List<Token> tokens = tokens("play Hello by Adele", List.of());

    SlotCollection fewerTags =
        SlotAssembler.assemble(tokens, List.of("o", "B-song"), MUSIC, List.of());
    assertEquals(List.of("song"), List.copyOf(fewerTags.names()));

    SlotCollection moreTags =
        SlotAssembler.assemble(
            tokens.subList(0, 2),
            List.of("o", "B-song", "o", "B-artist", "B-artist"),
            MUSIC,
            List.of());
    assertEquals(List.of("song"), List.copyOf(moreTags.names()));
  }

  @Test
  void nullTagsAreSkippedAndOrderFollowsFirstOccurrence() {
    SlotCollection slots =
        SlotAssembler.assemble(
            tokens("Adele sings Hello now", List.of()),
            Arrays.asList("B-artist", null, "B-song", "o"),
            MUSIC,
            List.of());
    assertEquals(List.of("artist", "song"), List.copyOf(slots.names()));
  }
}
