package com.gentoro.slotfill.preprocessing;

import com.gentoro.slotfill.exception.ValidationException;
import com.gentoro.slotfill.logging.LoggingService;
import com.gentoro.slotfill.model.BIO;
import com.gentoro.slotfill.model.Entity;
import com.gentoro.slotfill.model.IntentDefinition;
import com.gentoro.slotfill.model.Sequence;
import com.gentoro.slotfill.model.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link Sequence}s from raw text.
 *
 * <p>Training utterances use inline slot markup: {@code play [Kanye West](artist) please}. The
 * annotated text is tagged {@code B-artist}, {@code I-artist}; everything else is outside. Entity
 * offsets always refer to the plain text, i.e. the utterance with the markup removed.
 */
public final class SequenceGenerator {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SequenceGenerator.class);

  private static final Pattern SLOT_MARKUP = Pattern.compile("\\[(.+?)\\]\\(([^()\\s]+?)\\)");

  private SequenceGenerator() {}

  /** Training sequence without externally recognized entities. */
  public static Sequence forTraining(String markup, IntentDefinition intent) {
    return forTraining(markup, intent, List.of());
  }

  public static Sequence forTraining(
      String markup, IntentDefinition intent, List<Entity> entities) {
    Objects.requireNonNull(intent, "intent");
    if (markup == null || markup.isBlank()) {
      throw new ValidationException("Training utterance for intent " + intent.name() + " is empty");
    }
    List<Entity> safeEntities = entities == null ? List.of() : entities;

    StringBuilder plain = new StringBuilder();
    List<Token> tokens = new ArrayList<>();
    Matcher m = SLOT_MARKUP.matcher(markup);
    int cursor = 0;
    while (m.find()) {
      appendOutside(markup.substring(cursor, m.start()), plain, tokens, safeEntities);

      String surface = m.group(1);
      String slotName = m.group(2);
      if (!intent.declares(slotName)) {
        log.debug(
            "Slot '{}' is not declared on intent '{}', treating '{}' as plain text",
            slotName,
            intent.name(),
            surface);
        appendOutside(surface, plain, tokens, safeEntities);
      } else {
        int offset = plain.length();
        plain.append(surface);
        String text = plain.toString();
        List<TokenSpan> spans = Tokenizer.tokenize(text, offset, text.length());
        for (int i = 0; i < spans.size(); i++) {
          TokenSpan span = spans.get(i);
          tokens.add(
              new Token(
                  span.value(),
                  span.start(),
                  span.end(),
                  i == 0 ? BIO.BEGINNING : BIO.INSIDE,
                  slotName,
                  matchedEntities(span, safeEntities)));
        }
      }
      cursor = m.end();
    }
    appendOutside(markup.substring(cursor), plain, tokens, safeEntities);
    return new Sequence(tokens, intent.name());
  }

  /** Untagged sequence used at inference time. */
  public static Sequence forPrediction(String text, String intentName, List<Entity> entities) {
    Objects.requireNonNull(intentName, "intentName");
    List<Entity> safeEntities = entities == null ? List.of() : entities;
    List<Token> tokens = new ArrayList<>();
    for (TokenSpan span : Tokenizer.tokenize(text)) {
      Set<String> matched = matchedEntities(span, safeEntities);
      tokens.add(Token.outside(span.value(), span.start(), span.end(), matched));
    }
    return new Sequence(tokens, intentName);
  }

  private static void appendOutside(
      String chunk, StringBuilder plain, List<Token> tokens, List<Entity> entities) {
    if (chunk.isEmpty()) return;
    int offset = plain.length();
    plain.append(chunk);
    String text = plain.toString();
    for (TokenSpan span : Tokenizer.tokenize(text, offset, text.length())) {
      tokens.add(
          Token.outside(span.value(), span.start(), span.end(), matchedEntities(span, entities)));
    }
  }

  private static Set<String> matchedEntities(TokenSpan span, List<Entity> entities) {
    Set<String> names = new TreeSet<>();
    for (Entity e : entities) {
      if (e.covers(span.start(), span.end())) {
        names.add(e.name());
      }
    }
    return names;
  }
}
