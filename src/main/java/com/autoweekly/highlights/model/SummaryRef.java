package com.autoweekly.highlights.model;

import java.nio.file.Path;
import lombok.Value;

/** An {@code (itemId, summary artifact)} pair handed to the assembler. */
@Value
public class SummaryRef {
  String itemId;
  Path summaryPath;
}
