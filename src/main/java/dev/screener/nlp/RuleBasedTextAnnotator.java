package dev.screener.nlp;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight annotator built on regular expressions.
 * Entities are runs of capitalized tokens; noun phrases are the word runs left
 * after splitting on punctuation and function words, capped at four words.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.nlp.provider", havingValue = "rule-based")
public class RuleBasedTextAnnotator implements TextAnnotator {

    private static final int MAX_PHRASE_WORDS = 4;

    private static final Pattern CAPITALIZED_RUN = Pattern.compile(
            "\\b[A-Z][\\w+#]*(?:[ \\t]+[A-Z][\\w+#]*)*");
    private static final Pattern CLAUSE_BREAK = Pattern.compile("[\\n\\r.,;:!?()\\[\\]|•]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> FUNCTION_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "of", "in", "on", "at", "to", "for", "with",
            "by", "from", "as", "is", "are", "was", "were", "be", "been", "have", "has", "had",
            "i", "we", "you", "he", "she", "they", "it", "my", "our", "your", "their", "this",
            "that", "these", "those", "using", "used", "use", "including", "such", "also");

    public RuleBasedTextAnnotator() {
        log.info("NLP annotation enabled with rule-based annotator");
    }

    @Override
    public Annotations annotate(String text) {
        if (text == null || text.isBlank()) {
            return Annotations.none();
        }
        return new Annotations(findEntities(text), findNounPhrases(text));
    }

    private List<String> findEntities(String text) {
        Set<String> entities = new LinkedHashSet<>();
        Matcher matcher = CAPITALIZED_RUN.matcher(text);
        while (matcher.find()) {
            entities.add(matcher.group().trim());
        }
        return new ArrayList<>(entities);
    }

    private List<String> findNounPhrases(String text) {
        Set<String> phrases = new LinkedHashSet<>();
        for (String clause : CLAUSE_BREAK.split(text)) {
            List<String> run = new ArrayList<>();
            for (String word : WHITESPACE.split(clause.trim())) {
                if (word.isEmpty() || FUNCTION_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                    flush(run, phrases);
                } else {
                    run.add(word);
                    if (run.size() == MAX_PHRASE_WORDS) {
                        flush(run, phrases);
                    }
                }
            }
            flush(run, phrases);
        }
        return new ArrayList<>(phrases);
    }

    private void flush(List<String> run, Set<String> phrases) {
        if (!run.isEmpty()) {
            phrases.add(String.join(" ", run));
            run.clear();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getName() {
        return "rule-based";
    }
}
