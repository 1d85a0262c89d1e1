package com.autoweekly.highlights.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.autoweekly.highlights.prompt.PromptConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class PromptLoaderServiceTest {

  @TempDir Path dir;

  private final PromptLoaderService loader = new PromptLoaderService(new DefaultResourceLoader());

  @Test
  void bundledSummaryPromptCarriesItsRules() {
    String instructions = loader.loadInstructions("classpath:prompts/sellside_summary.yml");

    assertTrue(instructions.startsWith("You are a buy-side analyst assistant."));
    assertTrue(instructions.contains("**YYYY-MM-DD,<Broker>: <Report title>**"));
    assertTrue(instructions.contains("\n\nRules:\n- Use the publication date"));
  }

  @Test
  void yamlWithUserSectionIsAppended() throws Exception {
    Path file =
        Files.writeString(
            dir.resolve("p.yml"), "system: Be brief.\nuser: Report follows.\nrules:\n  a: No emoji.\n");

    PromptConfig cfg = loader.load(file.toUri().toString());

    assertEquals("Be brief.", cfg.getSystemTemplate());
    assertEquals("Be brief.\n\nRules:\n- No emoji.\n\nReport follows.", cfg.instructions());
  }

  @Test
  void plainTextIsUsedVerbatim() throws Exception {
    Path file = Files.writeString(dir.resolve("p.txt"), "Note: translate everything.\n");

    assertEquals("Note: translate everything.", loader.loadInstructions(file.toUri().toString()));
  }

  @Test
  void blankPromptIsRejected() throws Exception {
    Path file = Files.writeString(dir.resolve("empty.txt"), "  \n");

    assertThrows(
        IllegalStateException.class, () -> loader.loadInstructions(file.toUri().toString()));
  }

  @Test
  void missingPromptFailsFast() {
    assertThrows(
        IllegalStateException.class, () -> loader.load("classpath:prompts/does-not-exist.yml"));
  }
}
