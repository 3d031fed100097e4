package dev.screener.dictionary;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a raw skill mention into its canonical identifier.
 * Total and idempotent: normalize(normalize(s)) equals normalize(s).
 */
@Component
@RequiredArgsConstructor
public class SkillNormalizer {

    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s+#]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final AliasMap aliasMap;

    /**
     * Clean the input and resolve it through the alias map.
     *
     * @param rawSkill skill as written in the source text, may be null
     * @return canonical skill, or the cleaned input when no alias applies
     */
    public String normalize(String rawSkill) {
        return aliasMap.resolve(clean(rawSkill));
    }

    /**
     * Lower-case, drop characters other than word characters, whitespace, '+' and '#',
     * then collapse and trim whitespace.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        String stripped = DISALLOWED.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
