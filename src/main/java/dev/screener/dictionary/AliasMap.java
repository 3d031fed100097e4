package dev.screener.dictionary;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps surface-form variants to canonical skills.
 * Keys and targets are stored in cleaned form so that resolution is idempotent:
 * no target is itself an alias of a different skill.
 */
public final class AliasMap {

    private static final Map<String, String> DEFAULT_ALIASES = Map.ofEntries(
            Map.entry("js", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("cpp", "c++"),
            Map.entry("csharp", "c#"),
            Map.entry("py", "python"),
            Map.entry("node", "nodejs"),
            Map.entry("node.js", "nodejs"),
            Map.entry("react.js", "react"),
            Map.entry("reactjs", "react"),
            Map.entry("vue.js", "vue"),
            Map.entry("vuejs", "vue"),
            Map.entry("angular.js", "angular"),
            Map.entry("angularjs", "angular"));

    private final Map<String, String> aliases;

    private AliasMap(Map<String, String> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static AliasMap defaults() {
        return withCustom(Map.of());
    }

    /**
     * Built-in aliases overlaid with custom ones.
     *
     * @throws IllegalArgumentException if a target is an alias of another skill
     */
    public static AliasMap withCustom(Map<String, String> customAliases) {
        Map<String, String> merged = new HashMap<>();
        DEFAULT_ALIASES.forEach((variant, canonical) -> put(merged, variant, canonical));
        if (customAliases != null) {
            customAliases.forEach((variant, canonical) -> put(merged, variant, canonical));
        }
        validate(merged);
        return new AliasMap(merged);
    }

    public static AliasMap empty() {
        return new AliasMap(Map.of());
    }

    private static void put(Map<String, String> target, String variant, String canonical) {
        String key = SkillNormalizer.clean(variant);
        String value = SkillNormalizer.clean(canonical);
        if (key.isEmpty() || value.isEmpty() || key.equals(value)) {
            return;
        }
        target.put(key, value);
    }

    private static void validate(Map<String, String> aliases) {
        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            if (aliases.containsKey(entry.getValue())) {
                throw new IllegalArgumentException("Alias target '" + entry.getValue()
                        + "' of '" + entry.getKey() + "' is itself an alias of '"
                        + aliases.get(entry.getValue()) + "'");
            }
        }
    }

    /**
     * Resolve a cleaned skill string; unknown input is returned unchanged.
     */
    public String resolve(String cleaned) {
        return aliases.getOrDefault(cleaned, cleaned);
    }

    public Map<String, String> asMap() {
        return aliases;
    }
}
