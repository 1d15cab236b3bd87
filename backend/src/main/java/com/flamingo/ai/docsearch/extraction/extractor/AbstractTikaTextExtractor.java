package com.flamingo.ai.docsearch.extraction.extractor;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.exception.ExtractionException;
import com.flamingo.ai.docsearch.extraction.ExtractedText;
import com.flamingo.ai.docsearch.extraction.TextExtractor;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;

/**
 * Base class for Office formats read through Apache Tika's plain-text extraction.
 *
 * <p>Tika detects legacy and OOXML variants from content and file name, so one subclass covers
 * e.g. both {@code doc} and {@code docx}.
 */
@Slf4j
public abstract class AbstractTikaTextExtractor implements TextExtractor {

  private static final Tika TIKA = new Tika();

  /** Raw text cap handed to Tika; cleaning shortens the text further. */
  private final int rawTextLimit;

  protected AbstractTikaTextExtractor(DocSearchConfig config) {
    this.rawTextLimit = config.getExtraction().getMaxTextLength() * 2;
  }

  @Override
  public ExtractedText extract(String fileName, byte[] content) {
    Metadata metadata = new Metadata();
    metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    try {
      String text = TIKA.parseToString(new ByteArrayInputStream(content), metadata, rawTextLimit);
      log.debug(
          "Tika extracted {} chars from '{}' ({})",
          text.length(),
          fileName,
          metadata.get(Metadata.CONTENT_TYPE));
      return ExtractedText.of(text);
    } catch (IOException | TikaException e) {
      throw new ExtractionException(
          fileName, "Failed to extract " + format().tag() + " text: " + e.getMessage(), e);
    }
  }
}
