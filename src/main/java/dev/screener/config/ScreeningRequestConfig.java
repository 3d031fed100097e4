package dev.screener.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.screener.model.ScreeningRequest;
import dev.screener.model.ScreeningRequest.CandidateDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Configuration for loading the screening batch from a JSON file.
 */
@Slf4j
@Configuration
public class ScreeningRequestConfig {

  @Bean
  public ScreeningRequest screeningRequest(ObjectMapper objectMapper,
      @Value("${screener.request-file:screening.json}") String requestFile) {
    File file = new File(requestFile);
    if (!file.exists()) {
      log.warn("{} not found. Using empty screening request.", requestFile);
      return new ScreeningRequest();
    }

    ScreeningRequest request;
    try {
      request = objectMapper.readValue(file, ScreeningRequest.class);
    } catch (IOException e) {
      log.error("Failed to load {}. Ensure it matches the required structure.", requestFile, e);
      throw new IllegalStateException("Could not load screening request", e);
    }
    requireUniqueCandidateIds(request, requestFile);
    log.info("Loaded screening request for target {} with {} candidates",
        request.getTarget() != null ? request.getTarget().getId() : "-",
        request.getCandidates() != null ? request.getCandidates().size() : 0);
    return request;
  }

  // Candidate ids key the report's explanations, so they must be present and distinct
  private static void requireUniqueCandidateIds(ScreeningRequest request, String requestFile) {
    if (request.getCandidates() == null) {
      return;
    }
    Set<String> seen = new HashSet<>();
    for (CandidateDocument candidate : request.getCandidates()) {
      String id = candidate.getId();
      if (id == null || id.isBlank()) {
        throw new IllegalStateException("Candidate without id in " + requestFile);
      }
      if (!seen.add(id)) {
        throw new IllegalStateException("Duplicate candidate id '" + id + "' in " + requestFile);
      }
    }
  }
}
