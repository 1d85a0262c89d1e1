package com.autoweekly.highlights;

import com.autoweekly.highlights.config.PipelineProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the weekly sellside highlights pipeline.
 *
 * <p>Stages the week's raw broker reports, summarizes them on a bounded worker pool, and writes the
 * highlights document (plus its translation). The pipeline runs once and the application exits.
 * Any {@code highlights.*} setting can be overridden on the command line:
 *
 * <pre>
 *   java -jar sellside-highlights-service.jar --highlights.period=2025-09-12
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class HighlightsPipelineApplication {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    log.info("Starting highlights pipeline...");
    int exitCode =
        SpringApplication.exit(SpringApplication.run(HighlightsPipelineApplication.class, args));
    log.info("Highlights pipeline finished exitCode={}", exitCode);
    System.exit(exitCode);
  }
}
