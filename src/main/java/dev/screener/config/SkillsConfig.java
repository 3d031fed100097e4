package dev.screener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extensions to the built-in skill dictionary.
 * Loaded from application.yml under 'skills' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "skills")
public class SkillsConfig {

    private List<String> custom = new ArrayList<>();
    private Map<String, String> aliases = new HashMap<>();
}
