package dev.screener.config;

import dev.screener.dictionary.AliasMap;
import dev.screener.dictionary.SkillVocabulary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the shared, read-only skill dictionary from {@link SkillsConfig}.
 */
@Slf4j
@Configuration
public class DictionaryConfig {

    @Bean
    public SkillVocabulary skillVocabulary(SkillsConfig skillsConfig) {
        SkillVocabulary vocabulary = SkillVocabulary.withCustom(skillsConfig.getCustom());
        log.info("Loaded skill vocabulary with {} entries ({} custom)",
                vocabulary.size(), skillsConfig.getCustom().size());
        return vocabulary;
    }

    @Bean
    public AliasMap aliasMap(SkillsConfig skillsConfig) {
        AliasMap aliasMap = AliasMap.withCustom(skillsConfig.getAliases());
        log.info("Loaded {} skill aliases", aliasMap.asMap().size());
        return aliasMap;
    }
}
