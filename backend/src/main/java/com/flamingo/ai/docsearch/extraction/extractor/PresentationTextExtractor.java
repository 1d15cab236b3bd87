package com.flamingo.ai.docsearch.extraction.extractor;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.extraction.DocumentFormat;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Tika-backed extractor for PowerPoint decks; slide text and notes are extracted. */
@Component
public class PresentationTextExtractor extends AbstractTikaTextExtractor {

  public PresentationTextExtractor(DocSearchConfig config) {
    super(config);
  }

  @Override
  public Set<String> extensions() {
    return Set.of("ppt", "pptx");
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.PRESENTATION;
  }
}
