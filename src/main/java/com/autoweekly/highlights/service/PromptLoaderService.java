package com.autoweekly.highlights.service;

import com.autoweekly.highlights.prompt.PromptConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads prompt files from a Spring resource location ({@code classpath:...} or {@code file:...}).
 *
 * <p>A YAML mapping with {@code system}/{@code user}/{@code rules} keys is read as a {@link
 * PromptConfig}; any other content is used verbatim as the instructions.
 */
@Log4j2
@RequiredArgsConstructor
public class PromptLoaderService {

  private final ResourceLoader resourceLoader;

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  public PromptConfig load(String location) {
    Resource resource = resourceLoader.getResource(location);
    String raw;
    try (InputStream in = resource.getInputStream()) {
      raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load prompt from " + location, e);
    }

    PromptConfig cfg = new PromptConfig();
    try {
      Map<String, Object> map = yamlMapper.readValue(raw, new TypeReference<>() {});
      if (map != null && map.containsKey("system")) {
        cfg.setSystemTemplate(asString(map.get("system")));
        cfg.setUserTemplate(asString(map.get("user")));
        cfg.setRules(toStringMap(map.get("rules")));
        log.info("prompt.loaded location={} format=yaml", location);
        return cfg;
      }
    } catch (IOException yamlErr) {
      log.debug("prompt.yaml.unparsed location={} reason={}", location, yamlErr.getMessage());
    }

    cfg.setSystemTemplate(raw);
    cfg.setRules(Map.of());
    log.info("prompt.loaded location={} format=text", location);
    return cfg;
  }

  /** Loads {@code location} and returns its instruction text; blank prompts are rejected. */
  public String loadInstructions(String location) {
    String text = load(location).instructions();
    if (text.isBlank()) {
      throw new IllegalStateException("Prompt at " + location + " is empty");
    }
    return text;
  }

  private static String asString(Object o) {
    return (o == null) ? null : o.toString();
  }

  private static Map<String, String> toStringMap(Object node) {
    if (node == null) return Map.of();
    if (node instanceof Map<?, ?> src) {
      Map<String, String> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : src.entrySet()) {
        if (e.getValue() != null) {
          out.put(Objects.toString(e.getKey(), ""), e.getValue().toString());
        }
      }
      return out;
    }
    return Map.of();
  }
}
