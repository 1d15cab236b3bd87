package com.flamingo.ai.docsearch.extraction;

import com.flamingo.ai.docsearch.domain.model.PageText;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a document to the {@link TextExtractor} registered for its file extension.
 *
 * <p>Never throws for a single document: an unknown extension yields {@link
 * ExtractionOutcome.Status#UNSUPPORTED} and any extractor error yields {@link
 * ExtractionOutcome.Status#FAILED}.
 */
@Service
@Slf4j
public class TextExtractionDispatcher {

  private final Map<String, TextExtractor> extractorsByExtension;
  private final TextCleaner textCleaner;

  public TextExtractionDispatcher(List<TextExtractor> extractors, TextCleaner textCleaner) {
    this.textCleaner = textCleaner;
    Map<String, TextExtractor> byExtension = new HashMap<>();
    for (TextExtractor extractor : extractors) {
      for (String extension : extractor.extensions()) {
        TextExtractor previous = byExtension.put(extension.toLowerCase(Locale.ROOT), extractor);
        if (previous != null) {
          throw new IllegalStateException(
              "Extension '"
                  + extension
                  + "' claimed by both "
                  + previous.getClass().getSimpleName()
                  + " and "
                  + extractor.getClass().getSimpleName());
        }
      }
    }
    this.extractorsByExtension = Map.copyOf(byExtension);
  }

  /**
   * Extracts and cleans the text of one document.
   *
   * @param fileName file name whose extension selects the extractor
   * @param content raw document bytes
   */
  public ExtractionOutcome dispatch(String fileName, byte[] content) {
    String extension = extensionOf(fileName);
    TextExtractor extractor = extractorsByExtension.get(extension);
    if (extractor == null) {
      log.debug("No extractor for '{}' (extension '{}')", fileName, extension);
      return ExtractionOutcome.unsupported(extension);
    }

    try {
      ExtractedText raw = extractor.extract(fileName, content);
      String text = textCleaner.clean(raw.text());
      List<PageText> pages =
          extractor.format().isPaginated()
              ? raw.pages().stream()
                  .map(page -> new PageText(page.page(), textCleaner.clean(page.text())))
                  .toList()
              : List.of();
      return ExtractionOutcome.extracted(extractor.format(), text, pages);
    } catch (Exception e) {
      log.warn("Extraction failed for '{}': {}", fileName, e.getMessage());
      return ExtractionOutcome.failed(extractor.format(), describe(e));
    }
  }

  /** Returns the format that would handle the file, if any. */
  public Optional<DocumentFormat> formatOf(String fileName) {
    return Optional.ofNullable(extractorsByExtension.get(extensionOf(fileName)))
        .map(TextExtractor::format);
  }

  static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
