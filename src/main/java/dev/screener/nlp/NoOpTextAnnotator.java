package dev.screener.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Annotator used when no NLP backend is configured.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.nlp.provider", havingValue = "none", matchIfMissing = true)
public class NoOpTextAnnotator implements TextAnnotator {

    public NoOpTextAnnotator() {
        log.info("NLP annotation disabled - entity/phrase extraction contributes nothing");
    }

    @Override
    public Annotations annotate(String text) {
        return Annotations.none();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String getName() {
        return "none";
    }
}
