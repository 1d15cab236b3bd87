package com.flamingo.ai.docsearch.extraction.extractor;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.extraction.DocumentFormat;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Tika-backed extractor for Excel workbooks; every sheet's cells are extracted. */
@Component
public class SpreadsheetTextExtractor extends AbstractTikaTextExtractor {

  public SpreadsheetTextExtractor(DocSearchConfig config) {
    super(config);
  }

  @Override
  public Set<String> extensions() {
    return Set.of("xls", "xlsx");
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.SPREADSHEET;
  }
}
