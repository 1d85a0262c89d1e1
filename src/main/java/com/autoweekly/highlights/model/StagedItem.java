package com.autoweekly.highlights.model;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Value;

/**
 * A raw report that has been moved into the content store.
 *
 * <p>{@code itemId} is the join key for every later artifact of the same report (converted text,
 * cleaned text, summary). Two raw files mapping to the same id overwrite each other in the store.
 */
@Value
@Builder
public class StagedItem {

  /** Identifier derived from the original file name. */
  String itemId;

  /** Location of the stored copy, {@code store/{itemId}.<ext>}. */
  Path storedPath;

  /** Name of the inbox file the item was staged from; {@code null} when re-derived from store. */
  String originalName;
}
