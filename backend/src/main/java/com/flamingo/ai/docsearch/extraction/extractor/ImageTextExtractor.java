package com.flamingo.ai.docsearch.extraction.extractor;

import com.flamingo.ai.docsearch.extraction.DocumentFormat;
import com.flamingo.ai.docsearch.extraction.ExtractedText;
import com.flamingo.ai.docsearch.extraction.TextExtractor;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for raster images.
 *
 * <p>No OCR is performed: images yield empty text and are searchable by metadata only.
 */
@Component
public class ImageTextExtractor implements TextExtractor {

  @Override
  public Set<String> extensions() {
    return Set.of("jpg", "jpeg", "png", "gif", "bmp", "tif", "tiff", "webp");
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.IMAGE;
  }

  @Override
  public ExtractedText extract(String fileName, byte[] content) {
    return ExtractedText.of("");
  }
}
