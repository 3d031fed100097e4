package dev.screener.nlp;

import java.util.List;

/**
 * Spans found by a {@link TextAnnotator}.
 */
public record Annotations(List<String> entities, List<String> nounPhrases) {

    private static final Annotations NONE = new Annotations(List.of(), List.of());

    public Annotations {
        entities = entities != null ? List.copyOf(entities) : List.of();
        nounPhrases = nounPhrases != null ? List.copyOf(nounPhrases) : List.of();
    }

    public static Annotations none() {
        return NONE;
    }
}
