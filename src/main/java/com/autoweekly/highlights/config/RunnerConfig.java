package com.autoweekly.highlights.config;

import com.autoweekly.highlights.runner.HighlightsRunner;
import com.autoweekly.highlights.service.HighlightsPipelineService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RunnerConfig {

  @Bean
  @ConditionalOnProperty(
      prefix = "highlights",
      name = "run-on-startup",
      havingValue = "true",
      matchIfMissing = true)
  public HighlightsRunner highlightsRunner(HighlightsPipelineService pipeline) {
    return new HighlightsRunner(pipeline);
  }
}
