package com.autoweekly.highlights.service;

import com.autoweekly.highlights.config.PipelineSettings;
import com.autoweekly.highlights.store.ArtifactStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Produces the translated variant of the final document.
 *
 * <p>Skipped when the translation exists and is at least as new as the source. Failures are logged
 * and reported as {@code false}; the untranslated document stays valid either way.
 */
@Log4j2
public class TranslationService {

  private final ArtifactStore store;
  private final TextGenerationClient translator;
  private final ExternalCallExecutor calls;
  private final PipelineSettings settings;

  public TranslationService(
      ArtifactStore store,
      TextGenerationClient translator,
      ExternalCallExecutor calls,
      PipelineSettings settings) {
    this.store = Objects.requireNonNull(store);
    this.translator = Objects.requireNonNull(translator);
    this.calls = Objects.requireNonNull(calls);
    this.settings = Objects.requireNonNull(settings);
  }

  /**
   * @return {@code true} when {@code target} holds an up-to-date translation afterwards
   */
  public boolean translate(Path source, Path target) {
    if (!Files.isRegularFile(source)) {
      log.warn("translate.skip source={} reason=missing", source);
      return false;
    }
    if (isUpToDate(source, target)) {
      log.info("translate.skip target={} reason=upToDate", target);
      return true;
    }
    try {
      String text = store.read(source);
      String translated =
          calls.call(
              "translate " + source.getFileName(),
              () -> translator.generate(settings.getTranslationPrompt(), text));
      if (translated == null || translated.isBlank()) {
        log.error("translate.failed source={} reason=emptyOutput", source);
        return false;
      }
      store.writeAtomically(target, translated.strip() + "\n");
      log.info("translate.done target={}", target);
      return true;
    } catch (ExternalCallException | IOException e) {
      log.error("translate.failed source={} msg={}", source, e.getMessage(), e);
      return false;
    }
  }

  boolean isUpToDate(Path source, Path target) {
    if (!Files.isRegularFile(target)) {
      return false;
    }
    try {
      return Files.getLastModifiedTime(source).compareTo(Files.getLastModifiedTime(target)) <= 0;
    } catch (IOException e) {
      log.warn("translate.mtime.failed msg={}, translating anyway", e.getMessage());
      return false;
    }
  }
}
