package com.autoweekly.highlights.service;

import com.autoweekly.highlights.config.PipelineSettings;
import com.autoweekly.highlights.model.StagedItem;
import com.autoweekly.highlights.store.ArtifactStore;
import com.autoweekly.highlights.util.ItemIds;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;

/**
 * Moves inbox files into the content store.
 *
 * <p>Runs strictly before any worker starts, since it mutates the inbox. For each accepted file:
 * derive the item id, copy it to {@code store/{itemId}.<ext>}, then delete the original. A failed
 * copy leaves the original where it is and does not stop the other files. Afterwards the inbox is
 * tidied: leftover plain files (e.g. {@code .DS_Store}) are deleted and the empty folder removed;
 * anything else leaves the inbox untouched.
 */
@Log4j2
public class ContentStager {

  private final ArtifactStore store;
  private final PipelineSettings settings;

  public ContentStager(ArtifactStore store, PipelineSettings settings) {
    this.store = Objects.requireNonNull(store);
    this.settings = Objects.requireNonNull(settings);
  }

  /**
   * Stages every accepted inbox file, in dispatch order.
   *
   * @return staged items, one per item id; a later file with the same id replaces an earlier one
   */
  public List<StagedItem> stageInbox() {
    Path inbox = store.inboxDir();
    if (!Files.isDirectory(inbox)) {
      log.info("stage.skip inbox={} reason=missing", inbox);
      return List.of();
    }

    List<Path> raw;
    try {
      raw = discover(inbox);
    } catch (IOException e) {
      log.error("stage.list.failed inbox={} msg={}", inbox, e.getMessage(), e);
      return List.of();
    }
    if (raw.isEmpty()) {
      log.info("stage.empty inbox={}", inbox);
    }

    Map<String, StagedItem> staged = new LinkedHashMap<>();
    int failures = 0;
    for (Path file : raw) {
      StagedItem item = stageOne(file);
      if (item == null) {
        failures++;
        continue;
      }
      StagedItem previous = staged.remove(item.getItemId());
      if (previous != null) {
        log.warn(
            "stage.collision itemId={} replaced={} by={}",
            item.getItemId(),
            previous.getOriginalName(),
            item.getOriginalName());
      }
      staged.put(item.getItemId(), item);
    }

    if (failures > 0) {
      log.warn("stage.cleanup.skip inbox={} reason=failedItems count={}", inbox, failures);
    } else {
      cleanupInbox(inbox);
    }
    log.info("stage.finish staged={} failed={}", staged.size(), failures);
    return new ArrayList<>(staged.values());
  }

  /** Copies one raw file into the store and deletes it; {@code null} if the copy failed. */
  StagedItem stageOne(Path raw) {
    String name = raw.getFileName().toString();
    String itemId = ItemIds.extractItemId(name);
    Path stored;
    try {
      stored = store.copyIntoStore(raw, itemId);
    } catch (IOException e) {
      log.error("stage.copy.failed file={} itemId={} msg={}", name, itemId, e.getMessage());
      return null;
    }
    try {
      Files.delete(raw);
    } catch (IOException e) {
      log.warn("stage.delete.failed file={} msg={}", name, e.getMessage());
    }
    log.info("stage.item file={} itemId={} stored={}", name, itemId, stored.getFileName());
    return StagedItem.builder().itemId(itemId).storedPath(stored).originalName(name).build();
  }

  void cleanupInbox(Path inbox) {
    try {
      List<Path> leftover = list(inbox);
      if (!leftover.isEmpty() && leftover.stream().allMatch(Files::isRegularFile)) {
        for (Path p : leftover) {
          try {
            Files.delete(p);
            log.debug("stage.cleanup.deleted file={}", p.getFileName());
          } catch (IOException e) {
            log.warn("stage.cleanup.delete.failed file={} msg={}", p, e.getMessage());
          }
        }
        leftover = list(inbox);
      }
      if (leftover.isEmpty()) {
        Files.delete(inbox);
        log.info("stage.cleanup.removed inbox={}", inbox);
      } else {
        log.info("stage.cleanup.skip inbox={} reason=notEmpty entries={}", inbox, leftover.size());
      }
    } catch (IOException e) {
      log.warn("stage.cleanup.failed inbox={} msg={}", inbox, e.getMessage());
    }
  }

  private List<Path> discover(Path inbox) throws IOException {
    try (Stream<Path> files = Files.list(inbox)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> settings.accepts(p.getFileName().toString()))
          .sorted(Comparator.comparing(p -> p.getFileName().toString(), ItemIds.DISPATCH_ORDER))
          .collect(Collectors.toList());
    }
  }

  private static List<Path> list(Path dir) throws IOException {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries.collect(Collectors.toList());
    }
  }
}
