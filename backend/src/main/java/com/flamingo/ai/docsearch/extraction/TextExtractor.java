package com.flamingo.ai.docsearch.extraction;

import com.flamingo.ai.docsearch.exception.ExtractionException;
import java.util.Set;

/**
 * Extracts plain text from the binary content of one document format.
 *
 * <p>Implementations are Spring beans collected by {@link TextExtractionDispatcher}. Each claims a
 * set of lower-case file extensions; no two extractors may claim the same extension.
 */
public interface TextExtractor {

  /** Lower-case file extensions handled by this extractor, without the dot. */
  Set<String> extensions();

  DocumentFormat format();

  /**
   * Extracts text from a document blob.
   *
   * @param fileName original file name, used for diagnostics and format hints
   * @param content raw document bytes
   * @return uncleaned text and, for paginated formats, per-page text
   * @throws ExtractionException if the content cannot be read
   */
  ExtractedText extract(String fileName, byte[] content);
}
