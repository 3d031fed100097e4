package dev.screener.nlp;

/**
 * Optional NLP capability exposing named entities and noun phrases.
 * Extraction checks {@link #isAvailable()} and never depends on a concrete backend.
 */
public interface TextAnnotator {

    /**
     * Annotate a document.
     *
     * @param text cleaned document text
     * @return entities and noun phrases found, never null
     */
    Annotations annotate(String text);

    /**
     * Check if this annotator can be used.
     *
     * @return true if a backend is configured and loaded
     */
    boolean isAvailable();

    /**
     * Short backend name for logs.
     */
    String getName();
}
