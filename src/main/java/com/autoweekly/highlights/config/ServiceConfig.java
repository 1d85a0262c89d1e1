package com.autoweekly.highlights.config;

import com.autoweekly.highlights.service.BoilerplateCleaner;
import com.autoweekly.highlights.service.ChatClientTextGenerationClient;
import com.autoweekly.highlights.service.ContentStager;
import com.autoweekly.highlights.service.ConversionOrchestrator;
import com.autoweekly.highlights.service.DocumentTextExtractor;
import com.autoweekly.highlights.service.EmbeddedDateParser;
import com.autoweekly.highlights.service.ExternalCallExecutor;
import com.autoweekly.highlights.service.HeaderDateNormalizer;
import com.autoweekly.highlights.service.HighlightsAssembler;
import com.autoweekly.highlights.service.HighlightsPipelineService;
import com.autoweekly.highlights.service.ItemProcessor;
import com.autoweekly.highlights.service.PdfBoxTextExtractor;
import com.autoweekly.highlights.service.PromptLoaderService;
import com.autoweekly.highlights.service.TextGenerationClient;
import com.autoweekly.highlights.service.TranslationService;
import com.autoweekly.highlights.store.ArtifactStore;
import com.autoweekly.highlights.util.WeekPeriods;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Locale;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Log4j2
@Configuration
public class ServiceConfig {

  // -------------------
  // Settings
  // -------------------

  @Bean
  public PromptLoaderService promptLoaderService(ResourceLoader resourceLoader) {
    return new PromptLoaderService(resourceLoader);
  }

  @Bean
  public PipelineSettings pipelineSettings(
      PipelineProperties props, PromptLoaderService promptLoader) {
    LocalDate reference = WeekPeriods.resolve(props.getPeriod(), LocalDate.now());
    String period = reference.format(WeekPeriods.PERIOD_FORMAT);

    PipelineSettings.PipelineSettingsBuilder builder =
        PipelineSettings.builder()
            .period(period)
            .referenceDate(reference)
            .inboxDir(Path.of(props.getInboxDir()).resolve(period))
            .storeDir(Path.of(props.getStoreDir()).resolve(period))
            .workDir(Path.of(props.getWorkDir()).resolve(period))
            .finalDir(Path.of(props.getFinalDir()))
            .workerCount(props.getWorkerCount())
            .callTimeout(props.getCallTimeout())
            .minSummaryLength(props.getMinSummaryLength())
            .dateWindowDays(props.getDateWindowDays())
            .renderOrder(props.getRenderOrder())
            .linkTemplate(props.getLinkTemplate())
            .titleTemplate(props.getTitleTemplate())
            .summaryPrompt(promptLoader.loadInstructions(props.getSummaryPrompt()))
            .translationEnabled(props.isTranslationEnabled());
    props.getAcceptedExtensions().stream()
        .map(ext -> ext.replaceFirst("^\\.", "").toLowerCase(Locale.ROOT))
        .forEach(builder::acceptedExtension);
    if (props.isTranslationEnabled()) {
      builder.translationPrompt(promptLoader.loadInstructions(props.getTranslationPrompt()));
    }

    PipelineSettings settings = builder.build();
    log.info(
        "settings period={} inbox={} store={} work={} workers={} timeout={} order={}",
        settings.getPeriod(),
        settings.getInboxDir(),
        settings.getStoreDir(),
        settings.getWorkDir(),
        settings.getWorkerCount(),
        settings.getCallTimeout(),
        settings.getRenderOrder());
    return settings;
  }

  // -------------------
  // External services
  // -------------------

  @Bean
  public DocumentTextExtractor documentTextExtractor() {
    return new PdfBoxTextExtractor();
  }

  @Bean
  public TextGenerationClient textGenerationClient(ChatClient.Builder chatClientBuilder) {
    return new ChatClientTextGenerationClient(chatClientBuilder);
  }

  @Bean
  public ExternalCallExecutor externalCallExecutor(PipelineSettings settings) {
    return new ExternalCallExecutor(settings.getCallTimeout(), settings.getWorkerCount());
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public ArtifactStore artifactStore(PipelineSettings settings) {
    return new ArtifactStore(settings);
  }

  @Bean
  public ContentStager contentStager(ArtifactStore store, PipelineSettings settings) {
    return new ContentStager(store, settings);
  }

  @Bean
  public ItemProcessor itemProcessor(
      ArtifactStore store,
      DocumentTextExtractor extractor,
      TextGenerationClient textGenerationClient,
      ExternalCallExecutor calls,
      PipelineSettings settings) {
    return new ItemProcessor(
        store, extractor, new BoilerplateCleaner(), textGenerationClient, calls, settings);
  }

  @Bean
  public ConversionOrchestrator conversionOrchestrator(
      ItemProcessor itemProcessor,
      @Qualifier("highlightsWorkerPool") ThreadPoolTaskExecutor highlightsWorkerPool) {
    return new ConversionOrchestrator(itemProcessor, highlightsWorkerPool);
  }

  @Bean
  public HeaderDateNormalizer headerDateNormalizer(PipelineSettings settings) {
    return new HeaderDateNormalizer(new EmbeddedDateParser(), settings);
  }

  @Bean
  public HighlightsAssembler highlightsAssembler(
      ArtifactStore store, HeaderDateNormalizer normalizer, PipelineSettings settings) {
    return new HighlightsAssembler(store, normalizer, settings);
  }

  @Bean
  public TranslationService translationService(
      ArtifactStore store,
      TextGenerationClient textGenerationClient,
      ExternalCallExecutor calls,
      PipelineSettings settings) {
    return new TranslationService(store, textGenerationClient, calls, settings);
  }

  @Bean
  public HighlightsPipelineService highlightsPipelineService(
      ArtifactStore store,
      ContentStager stager,
      ConversionOrchestrator orchestrator,
      HighlightsAssembler assembler,
      TranslationService translation,
      PipelineSettings settings) {
    return new HighlightsPipelineService(
        store, stager, orchestrator, assembler, translation, settings);
  }
}
