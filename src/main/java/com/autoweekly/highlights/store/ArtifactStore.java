package com.autoweekly.highlights.store;

import com.autoweekly.highlights.config.PipelineSettings;
import com.autoweekly.highlights.model.StagedItem;
import com.autoweekly.highlights.model.SummaryRef;
import com.autoweekly.highlights.util.ItemIds;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;

/**
 * Filesystem layout of one period.
 *
 * <pre>
 *   store/{itemId}.&lt;ext&gt;
 *   work/text/{itemId}.md
 *   work/cleaned/{itemId}.md
 *   work/summary/{itemId}.md
 *   final/{period}_highlights.md
 * </pre>
 *
 * <p>Presence of an artifact file is the only "already done" marker. Writes go through a temporary
 * sibling and an atomic move, so a crashed writer never leaves a partial artifact behind under the
 * final name. Paths are partitioned by item id and no two workers ever write the same file.
 */
@Log4j2
public class ArtifactStore {

  private static final String ARTIFACT_SUFFIX = ".md";
  private static final String TEMP_SUFFIX = ".tmp";

  private final PipelineSettings settings;

  public ArtifactStore(PipelineSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
  }

  public Path inboxDir() {
    return settings.getInboxDir();
  }

  public Path storeDir() {
    return settings.getStoreDir();
  }

  public Path dir(ArtifactKind kind) {
    return settings.getWorkDir().resolve(kind.folder());
  }

  public Path path(ArtifactKind kind, String itemId) {
    return dir(kind).resolve(itemId + ARTIFACT_SUFFIX);
  }

  public boolean exists(ArtifactKind kind, String itemId) {
    return Files.isRegularFile(path(kind, itemId));
  }

  /** Creates every output folder of the period. The inbox is never created. */
  public void ensureDirectories() throws IOException {
    Files.createDirectories(storeDir());
    for (ArtifactKind kind : ArtifactKind.values()) {
      Files.createDirectories(dir(kind));
    }
    Files.createDirectories(settings.getFinalDir());
  }

  public String read(Path path) throws IOException {
    return Files.readString(path, StandardCharsets.UTF_8);
  }

  /** Reads an artifact if it exists; unreadable files are logged and treated as absent. */
  public Optional<String> readIfPresent(ArtifactKind kind, String itemId) {
    Path p = path(kind, itemId);
    if (!Files.isRegularFile(p)) {
      return Optional.empty();
    }
    try {
      return Optional.of(read(p));
    } catch (IOException e) {
      log.warn("store.read.failed path={} msg={}", p, e.getMessage());
      return Optional.empty();
    }
  }

  public Path write(ArtifactKind kind, String itemId, String content) throws IOException {
    Path target = path(kind, itemId);
    writeAtomically(target, content);
    return target;
  }

  /** Writes {@code content} to a temporary sibling, then moves it over {@code target}. */
  public void writeAtomically(Path target, String content) throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path tmp = parent.resolve("." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
    try {
      Files.writeString(tmp, content, StandardCharsets.UTF_8);
      moveIntoPlace(tmp, target);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  /**
   * Copies {@code source} into the content store under {@code {itemId}.<ext>}, replacing. Any other
   * stored file of the same item (e.g. a different extension) is removed, so the store holds one
   * object per item id.
   */
  public Path copyIntoStore(Path source, String itemId) throws IOException {
    String ext = ItemIds.extension(source.getFileName().toString());
    String name = ext.isEmpty() ? itemId : itemId + "." + ext;
    Path target = storeDir().resolve(name);
    Files.createDirectories(storeDir());
    Path tmp = storeDir().resolve("." + name + "." + UUID.randomUUID() + TEMP_SUFFIX);
    try {
      Files.copy(source, tmp, StandardCopyOption.COPY_ATTRIBUTES);
      moveIntoPlace(tmp, target);
    } finally {
      Files.deleteIfExists(tmp);
    }
    removeOtherCopies(itemId, target);
    return target;
  }

  /** Summary artifacts of the period, ordered by file name. */
  public List<SummaryRef> listSummaries() throws IOException {
    Path dir = dir(ArtifactKind.SUMMARY);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    List<SummaryRef> refs = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      files
          .filter(Files::isRegularFile)
          .filter(p -> isArtifactName(p.getFileName().toString()))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .forEach(p -> refs.add(new SummaryRef(stripSuffix(p.getFileName().toString()), p)));
    }
    return refs;
  }

  /**
   * Items already in the content store, one per item id, ordered by file name. When several files
   * map to the same id the most recently modified one is used.
   */
  public List<StagedItem> listStoredItems() throws IOException {
    if (!Files.isDirectory(storeDir())) {
      return List.of();
    }
    List<Path> stored;
    try (Stream<Path> files = Files.list(storeDir())) {
      stored =
          files
              .filter(Files::isRegularFile)
              .filter(p -> !p.getFileName().toString().startsWith("."))
              .filter(p -> settings.accepts(p.getFileName().toString()))
              .sorted(Comparator.comparing(p -> p.getFileName().toString()))
              .collect(Collectors.toList());
    }

    Map<String, Path> byId = new LinkedHashMap<>();
    for (Path p : stored) {
      String itemId = ItemIds.extractItemId(p.getFileName().toString());
      Path previous = byId.get(itemId);
      if (previous == null) {
        byId.put(itemId, p);
        continue;
      }
      Path newer = isNewer(p, previous) ? p : previous;
      log.warn(
          "store.collision itemId={} kept={} ignored={}",
          itemId,
          newer.getFileName(),
          (newer == p ? previous : p).getFileName());
      byId.put(itemId, newer);
    }

    List<StagedItem> items = new ArrayList<>(byId.size());
    byId.forEach(
        (itemId, p) -> items.add(StagedItem.builder().itemId(itemId).storedPath(p).build()));
    return items;
  }

  private void removeOtherCopies(String itemId, Path keep) throws IOException {
    List<Path> others;
    try (Stream<Path> files = Files.list(storeDir())) {
      others =
          files
              .filter(Files::isRegularFile)
              .filter(p -> !p.getFileName().toString().startsWith("."))
              .filter(p -> !p.getFileName().equals(keep.getFileName()))
              .filter(p -> ItemIds.extractItemId(p.getFileName().toString()).equals(itemId))
              .collect(Collectors.toList());
    }
    for (Path other : others) {
      // case-insensitive filesystems list the replaced name for the kept file
      if (Files.isSameFile(other, keep)) {
        continue;
      }
      Files.deleteIfExists(other);
      log.info(
          "store.replaced itemId={} removed={} by={}",
          itemId,
          other.getFileName(),
          keep.getFileName());
    }
  }

  private static boolean isNewer(Path candidate, Path current) throws IOException {
    return Files.getLastModifiedTime(candidate).compareTo(Files.getLastModifiedTime(current)) > 0;
  }

  private static void moveIntoPlace(Path tmp, Path target) throws IOException {
    try {
      Files.move(
          tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("store.move atomic move unsupported for {}, falling back", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static boolean isArtifactName(String name) {
    return name.endsWith(ARTIFACT_SUFFIX) && !name.startsWith(".");
  }

  private static String stripSuffix(String name) {
    return name.substring(0, name.length() - ARTIFACT_SUFFIX.length());
  }
}
