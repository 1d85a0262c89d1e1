package com.autoweekly.highlights.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Raw {@code highlights.*} configuration as bound by Spring.
 *
 * <p>Only {@link ServiceConfig} reads this class; it is turned into an immutable {@link
 * PipelineSettings} once at startup.
 */
@Data
@ConfigurationProperties(prefix = "highlights")
public class PipelineProperties {

  /** Week anchor as {@code yyyy-MM-dd}; blank means Friday of the current week. */
  private String period;

  /** Run the pipeline once when the application starts. */
  private boolean runOnStartup = true;

  private String inboxDir = "inbox";
  private String storeDir = "data/sellside_reports";
  private String workDir = "data/temp/sellside";
  private String finalDir = "data/6_final_mds";

  private List<String> acceptedExtensions = new ArrayList<>(List.of("pdf"));

  private int workerCount = 10;

  private Duration callTimeout = Duration.ofMinutes(10);

  private int minSummaryLength = 10;

  private int dateWindowDays = 14;

  private PipelineSettings.RenderOrder renderOrder = PipelineSettings.RenderOrder.SORTED;

  private String linkTemplate = "https://auto.bda-news.com/{period}/{itemId}.pdf";

  private String titleTemplate = "# Sellside highlights for Week – {period}";

  private String summaryPrompt = "classpath:prompts/sellside_summary.yml";

  private String translationPrompt = "classpath:prompts/translation.yml";

  private boolean translationEnabled = true;
}
