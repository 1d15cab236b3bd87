package com.flamingo.ai.docsearch.extraction.extractor;

import com.flamingo.ai.docsearch.domain.model.PageText;
import com.flamingo.ai.docsearch.exception.ExtractionException;
import com.flamingo.ai.docsearch.extraction.DocumentFormat;
import com.flamingo.ai.docsearch.extraction.ExtractedText;
import com.flamingo.ai.docsearch.extraction.TextExtractor;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for PDF documents.
 *
 * <p>Uses Apache PDFBox 3.x to extract text page by page. A page that cannot be read is logged and
 * left out; the document still succeeds with the remaining pages. The full text is the page texts
 * joined by blank lines.
 */
@Component
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public Set<String> extensions() {
    return Set.of("pdf");
  }

  @Override
  public DocumentFormat format() {
    return DocumentFormat.PDF;
  }

  @Override
  public ExtractedText extract(String fileName, byte[] content) {
    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      List<PageText> pages = extractPages(fileName, pdfDoc);
      String fullText =
          pages.stream()
              .map(PageText::text)
              .filter(text -> !text.isBlank())
              .collect(Collectors.joining("\n\n"));
      return new ExtractedText(fullText, pages);
    } catch (IOException e) {
      throw new ExtractionException(fileName, "Failed to read PDF: " + e.getMessage(), e);
    }
  }

  private List<PageText> extractPages(String fileName, PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    int pageCount = pdfDoc.getNumberOfPages();
    List<PageText> pages = new ArrayList<>(pageCount);
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      try {
        pages.add(new PageText(page, stripper.getText(pdfDoc)));
      } catch (IOException | RuntimeException e) {
        log.warn("Skipping unreadable page {} of '{}': {}", page, fileName, e.getMessage());
      }
    }
    return pages;
  }
}
