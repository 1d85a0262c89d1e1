package com.autoweekly.highlights.store;

/** Per-item intermediate artifacts, each stored in its own folder as {@code {itemId}.md}. */
public enum ArtifactKind {
  TEXT("text"),
  CLEANED("cleaned"),
  SUMMARY("summary");

  private final String folder;

  ArtifactKind(String folder) {
    this.folder = folder;
  }

  public String folder() {
    return folder;
  }
}
