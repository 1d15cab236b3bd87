package com.flamingo.ai.docsearch.extraction.extractor;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.extraction.DocumentFormat;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Tika-backed extractor for Word documents. */
@Component
public class WordTextExtractor extends AbstractTikaTextExtractor {

  public WordTextExtractor(DocSearchConfig config) {
    super(config);
  }

  @Override
  public Set<String> extensions() {
    return Set.of("doc", "docx");
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.WORD;
  }
}
