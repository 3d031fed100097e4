package dev.screener.extraction;

import dev.screener.dictionary.SkillVocabulary;
import dev.screener.dictionary.TextCleaner;
import dev.screener.extraction.impl.KeywordScanStrategy;
import dev.screener.model.ExtractedSkillSet;
import dev.screener.model.RequirementSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates the skills a target requires from those it only prefers.
 * <p>
 * Spans after required headers ("required", "must have", "mandatory", ...) and preferred
 * headers ("preferred", "nice to have", "bonus", ...) are scanned for skills. A span ends at
 * the end of the sentence or the next header of either kind, so bulleted postings split cleanly.
 * When no header of either kind yields a skill, every skill in the document counts as
 * required and the preferred set is empty.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequirementSplitter {

    private static final Pattern REQUIRED_HEADER = Pattern.compile(
            "\\b(?:required|must\\s+have|mandatory|essential|requirements?)[:\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern PREFERRED_HEADER = Pattern.compile(
            "\\b(?:preferred|nice\\s+to\\s+have|bonus|desired|plus|advantage)[:\\s]+", Pattern.CASE_INSENSITIVE);

    /** Full stop that ends a sentence, not the one inside "node.js". */
    private static final Pattern SENTENCE_END = Pattern.compile("\\.(?=\\s|$)");

    private final SkillExtractor skillExtractor;
    private final KeywordScanStrategy keywordScan;
    private final VocabularyMatcher vocabularyMatcher;
    private final TextCleaner textCleaner;

    public RequirementSplit splitRequirements(String text) {
        return splitRequirements(text, skillExtractor.getVocabulary());
    }

    /**
     * Split a target document into required and preferred skills.
     *
     * @param text       raw target text
     * @param vocabulary skills that may be reported
     * @return required and preferred skills; all skills required when no header matched
     */
    public RequirementSplit splitRequirements(String text, SkillVocabulary vocabulary) {
        if (text == null || text.isBlank()) {
            return RequirementSplit.allRequired(ExtractedSkillSet.empty());
        }
        String cleaned = textCleaner.clean(text);

        Set<String> required = new HashSet<>();
        Set<String> preferred = new HashSet<>();
        List<Header> headers = findHeaders(cleaned);
        for (int i = 0; i < headers.size(); i++) {
            Header header = headers.get(i);
            int end = i + 1 < headers.size() ? headers.get(i + 1).start() : cleaned.length();
            String span = cleaned.substring(header.end(), Math.max(header.end(), end));
            Matcher stop = SENTENCE_END.matcher(span);
            Set<String> skills = scanSpan(stop.find() ? span.substring(0, stop.start()) : span, vocabulary);
            (header.required() ? required : preferred).addAll(skills);
        }

        if (required.isEmpty() && preferred.isEmpty()) {
            log.debug("No required/preferred sections found - treating all skills as required");
            return RequirementSplit.allRequired(skillExtractor.extract(text, vocabulary));
        }
        return new RequirementSplit(ExtractedSkillSet.of(required), ExtractedSkillSet.of(preferred));
    }

    private List<Header> findHeaders(String text) {
        List<Header> headers = new ArrayList<>();
        collect(REQUIRED_HEADER, text, true, headers);
        collect(PREFERRED_HEADER, text, false, headers);
        headers.sort(Comparator.comparingInt(Header::start));
        return headers;
    }

    private void collect(Pattern pattern, String text, boolean required, List<Header> headers) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            headers.add(new Header(matcher.start(), matcher.end(), required));
        }
    }

    private Set<String> scanSpan(String span, SkillVocabulary vocabulary) {
        Set<String> skills = new HashSet<>(keywordScan.extract(span, vocabulary));
        skills.addAll(vocabularyMatcher.matchSpan(span, vocabulary));
        return skills;
    }

    private record Header(int start, int end, boolean required) {
    }
}
