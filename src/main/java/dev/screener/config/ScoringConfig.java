package dev.screener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for scoring weights and ranking cut-offs.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    /** Signal weights by name. Left empty, the 0.4/0.4/0.2 defaults apply. */
    private Map<String, Double> weights = new HashMap<>();
    private double maxYears = 20.0;
    private double threshold = 0.5;
    private int topK = 10;
    private String similarityMethod = "cosine";
}
