package com.gentoro.slotfill.testing;

import com.gentoro.slotfill.model.IntentDefinition;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.SlotDefinition;
import com.gentoro.slotfill.preprocessing.SequenceGenerator;
import java.util.List;

/** Shared music-intent training data: 6 utterances, 30 distinct token values. */
public final class Fixtures {
  public static final IntentDefinition PLAY_MUSIC =
      new IntentDefinition(
          "play_music",
          List.of(new SlotDefinition("artist", "artist"), new SlotDefinition("song", "song")));

  public static final List<String> UTTERANCES =
      List.of(
          "play [Thriller](song) by [Michael Jackson](artist)",
          "I want to hear [Bad](song) please",
          "put on some [Kanye West](artist)",
          "could you play [Hey Jude](song) from [The Beatles](artist)",
          "start [Bohemian Rhapsody](song) now",
          "listen to [Adele](artist) tonight");

  private Fixtures() {}

  public static List<Sequence> trainingSet() {
    return UTTERANCES.stream().map(u -> SequenceGenerator.forTraining(u, PLAY_MUSIC)).toList();
  }
}
