package com.flamingo.ai.docsearch.extraction;

import com.flamingo.ai.docsearch.domain.model.PageText;
import java.util.List;

/**
 * Result of dispatching one document to an extractor.
 *
 * @param status what happened
 * @param format detected format, {@code null} when unsupported
 * @param text cleaned and truncated text, empty unless extracted
 * @param pageInfo cleaned per-page text, empty for non-paginated formats
 * @param reason failure cause or the unsupported extension
 */
public record ExtractionOutcome(
    Status status, DocumentFormat format, String text, List<PageText> pageInfo, String reason) {

  /** Dispatch status. */
  public enum Status {
    EXTRACTED,
    UNSUPPORTED,
    FAILED
  }

  public static ExtractionOutcome extracted(
      DocumentFormat format, String text, List<PageText> pageInfo) {
    return new ExtractionOutcome(Status.EXTRACTED, format, text, List.copyOf(pageInfo), null);
  }

  public static ExtractionOutcome unsupported(String extension) {
    return new ExtractionOutcome(
        Status.UNSUPPORTED, null, "", List.of(), "unsupported extension '" + extension + "'");
  }

  public static ExtractionOutcome failed(DocumentFormat format, String reason) {
    return new ExtractionOutcome(Status.FAILED, format, "", List.of(), reason);
  }

  public boolean isExtracted() {
    return status == Status.EXTRACTED;
  }
}
