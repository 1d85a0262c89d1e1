package com.autoweekly.highlights.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;

/**
 * A prompt file: the system instructions, an optional user preamble and named rules that are
 * appended to the instructions as a bullet list.
 */
@Data
public class PromptConfig {
  @JsonProperty("system")
  private String systemTemplate;

  @JsonProperty("user")
  private String userTemplate;

  @JsonProperty("rules")
  private Map<String, String> rules;

  /** System instructions followed by the rules, one {@code - rule} line each. */
  public String instructions() {
    StringBuilder out = new StringBuilder(systemTemplate == null ? "" : systemTemplate.strip());
    if (rules != null && !rules.isEmpty()) {
      out.append("\n\nRules:");
      rules.values().forEach(rule -> out.append("\n- ").append(rule.strip()));
    }
    if (userTemplate != null && !userTemplate.isBlank()) {
      out.append("\n\n").append(userTemplate.strip());
    }
    return out.toString();
  }
}
