package com.flamingo.ai.docsearch.extraction;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Extraction format of a document, stored on every index record as {@code format}. */
public enum DocumentFormat {
  PDF(true),
  WORD(false),
  SPREADSHEET(false),
  PRESENTATION(false),
  TEXT(false),
  IMAGE(false);

  private final boolean paginated;

  DocumentFormat(boolean paginated) {
    this.paginated = paginated;
  }

  /** Whether extraction yields per-page text usable for page location. */
  public boolean isPaginated() {
    return paginated;
  }

  /** Lower-case tag written to the index. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<DocumentFormat> fromTag(String tag) {
    return Arrays.stream(values()).filter(f -> f.tag().equals(tag)).findFirst();
  }
}
