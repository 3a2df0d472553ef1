package com.gentoro.slotfill.evaluation;

import com.gentoro.slotfill.exception.ValidationException;
import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.model.BIO;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.tagger.SlotTagger;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Scores a {@link SlotTagger} on held-out gold sequences, token by token. */
public final class TaggingEvaluator {
  private static final org.slf4j.Logger log = LoggingService.getLogger(TaggingEvaluator.class);

  private TaggingEvaluator() {}

  public static EvaluationReport evaluate(SlotTagger tagger, List<Sequence> gold) {
    if (gold == null || gold.isEmpty()) {
      throw new ValidationException("Evaluation needs at least one gold sequence");
    }
    Map<String, int[]> counts = new TreeMap<>(); // truePositives, predicted, support
    int tokens = 0;
    int correct = 0;
    for (Sequence sequence : gold) {
      List<String> expected = sequence.labels();
      List<String> predicted = tagger.tag(sequence);
      for (int i = 0; i < expected.size(); i++) {
        String want = expected.get(i);
        String got = i < predicted.size() ? predicted.get(i) : BIO.OUT.code();
        tokens++;
        if (want.equals(got)) correct++;
        if (BIO.fromLabel(want) != BIO.OUT) {
          counts.computeIfAbsent(want, k -> new int[3])[2]++;
        }
        if (BIO.fromLabel(got) != BIO.OUT) {
          int[] c = counts.computeIfAbsent(got, k -> new int[3]);
          c[1]++;
          if (want.equals(got)) c[0]++;
        }
      }
    }
    Map<String, LabelScore> labels = new TreeMap<>();
    counts.forEach((label, c) -> labels.put(label, new LabelScore(c[0], c[1], c[2])));
    EvaluationReport report = new EvaluationReport(gold.size(), tokens, correct, labels);
    log.info(
        "Evaluated {} sequences: token accuracy {}, macro F1 {}",
        report.sequences(),
        String.format("%.3f", report.tokenAccuracy()),
        String.format("%.3f", report.macroF1()));
    return report;
  }
}
