package dev.screener.config;

import dev.screener.ExitManager;
import dev.screener.PipelineRunner;
import dev.screener.dictionary.AliasMap;
import dev.screener.dictionary.SkillVocabulary;
import dev.screener.model.ScreeningRequest;
import dev.screener.service.ScoringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ScoringConfig scoringConfig;

  @Autowired
  private SkillsConfig skillsConfig;

  @Autowired
  private SkillVocabulary skillVocabulary;

  @Autowired
  private AliasMap aliasMap;

  @Autowired
  private ScoringService scoringService;

  @Autowired
  private ScreeningRequest screeningRequest;

  @Test
  void shouldLoadScoringConfig() {
    assertThat(scoringConfig.getWeights())
        .containsOnlyKeys("skill_match", "semantic_similarity", "experience");
    assertThat(scoringConfig.getThreshold()).isEqualTo(0.5);
    assertThat(scoringConfig.getTopK()).isEqualTo(10);
    assertThat(scoringService.getWeights().skillMatch()).isCloseTo(0.4, within(1e-9));
  }

  @Test
  void shouldBindPartialWeightsWithoutDefaults() {
    Binder binder = new Binder(new MapConfigurationPropertySource(Map.of(
        "scoring.weights[skill_match]", "1.0",
        "scoring.weights[experience]", "0")));
    ScoringConfig config = new ScoringConfig();

    binder.bind("scoring", Bindable.ofInstance(config));
    ScoringService service = new ScoringService(config);

    assertThat(config.getWeights()).containsOnlyKeys("skill_match", "experience");
    assertThat(service.getWeights().skillMatch()).isCloseTo(1.0, within(1e-9));
    assertThat(service.getWeights().semanticSimilarity()).isZero();
  }

  @Test
  void shouldLoadSkillsConfig() {
    assertThat(skillsConfig.getAliases()).containsEntry("k8s", "kubernetes");
    assertThat(aliasMap.resolve("k8s")).isEqualTo("kubernetes");
    assertThat(aliasMap.resolve("js")).isEqualTo("javascript");
    assertThat(skillVocabulary.contains("python")).isTrue();
  }

  @Test
  void shouldFallBackToEmptyRequestWhenFileIsMissing() {
    assertThat(screeningRequest.getTarget()).isNull();
    assertThat(screeningRequest.getCandidates()).isNullOrEmpty();
  }
}
