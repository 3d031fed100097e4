package dev.screener.extraction;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a years-of-experience figure from free text.
 */
@Component
public class ExperienceParser {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(\\d+(?:\\.\\d+)?)\\+?\\s*(?:years?|yrs?)(?:\\s+of)?\\s+(?:experience|exp)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:experience|exp)(?:\\s+of)?\\s+(\\d+(?:\\.\\d+)?)\\+?\\s*(?:years?|yrs?)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+(?:\\.\\d+)?)\\+?\\s*(?:years?|yrs?)\\s+(?:professional|work|industry)\\b", Pattern.CASE_INSENSITIVE));

    /**
     * Largest years value mentioned in an experience phrase.
     *
     * @return years found, or 0 when the text states none
     */
    public double yearsOfExperience(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        double max = 0.0;
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                max = Math.max(max, Double.parseDouble(matcher.group(1)));
            }
        }
        return max;
    }
}
