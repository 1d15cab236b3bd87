package com.flamingo.ai.docsearch.api.rest;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.model.DocumentContent;
import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.domain.model.DocumentPage;
import com.flamingo.ai.docsearch.exception.ApiError;
import com.flamingo.ai.docsearch.exception.DocumentNotFoundException;
import com.flamingo.ai.docsearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.docsearch.exception.MalformedIdentityException;
import com.flamingo.ai.docsearch.service.document.DocumentService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentController Tests")
class DocumentControllerTest {

  private static final byte[] PDF_BYTES = "%PDF-1.7 sample".getBytes(StandardCharsets.US_ASCII);

  private MockMvc mockMvc;

  @Mock private DocumentService documentService;

  @BeforeEach
  void setUp() {
    DocumentController controller = new DocumentController(documentService, new DocSearchConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return document metadata")
  void shouldReturnDocument() throws Exception {
    when(documentService.getDocument("FORMS_MASTER:1")).thenReturn(meta());

    mockMvc
        .perform(get("/api/document/{id}", "FORMS_MASTER:1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("FORMS_MASTER:1"))
        .andExpect(jsonPath("$.sourceTable").value("FORMS_MASTER"))
        .andExpect(jsonPath("$.rowId").value("1"))
        .andExpect(jsonPath("$.size").value(PDF_BYTES.length))
        .andExpect(jsonPath("$.metadata.department").value("HSE"));
  }

  @Test
  @DisplayName("Should return 404 for an unknown document")
  void shouldReturnNotFound() throws Exception {
    when(documentService.getDocument("FORMS_MASTER:404"))
        .thenThrow(new DocumentNotFoundException("FORMS_MASTER:404"));

    mockMvc
        .perform(get("/api/document/{id}", "FORMS_MASTER:404"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_NOT_FOUND));
  }

  @Test
  @DisplayName("Should return 400 for a malformed id")
  void shouldReturnBadRequestForMalformedId() throws Exception {
    when(documentService.getDocument("garbage"))
        .thenThrow(new MalformedIdentityException("garbage", "missing ':' delimiter"));

    mockMvc
        .perform(get("/api/document/{id}", "garbage"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.MALFORMED_IDENTITY));
  }

  @Test
  @DisplayName("Should return 400 for a non-numeric list window")
  void shouldReturnBadRequestForNonNumericWindow() throws Exception {
    mockMvc
        .perform(get("/api/documents").param("limit", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR))
        .andExpect(jsonPath("$.message").value(containsString("limit")));

    mockMvc
        .perform(get("/api/documents").param("offset", "x"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }

  @Test
  @DisplayName("Should list documents with the default window")
  void shouldListDocuments() throws Exception {
    when(documentService.listDocuments(100, 0))
        .thenReturn(new DocumentPage(List.of(meta()), 1, 100, 0));

    mockMvc
        .perform(get("/api/documents"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.limit").value(100))
        .andExpect(jsonPath("$.documents[0].id").value("FORMS_MASTER:1"));
  }

  @Test
  @DisplayName("Should pass the requested window through")
  void shouldListDocumentsWithWindow() throws Exception {
    when(documentService.listDocuments(5, 10)).thenReturn(new DocumentPage(List.of(), 3, 5, 10));

    mockMvc
        .perform(get("/api/documents").param("limit", "5").param("offset", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.documents").isEmpty());

    verify(documentService).listDocuments(5, 10);
  }

  @Test
  @DisplayName("Should stream content inline through the proxy")
  void shouldProxyContentInline() throws Exception {
    when(documentService.getContent("FORMS_MASTER:1"))
        .thenReturn(new DocumentContent(meta(), PDF_BYTES));

    mockMvc
        .perform(get("/api/document/{id}/proxy", "FORMS_MASTER:1"))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "application/pdf"))
        .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("inline")))
        .andExpect(header().string(HttpHeaders.ACCEPT_RANGES, "bytes"))
        .andExpect(content().bytes(PDF_BYTES));
  }

  @Test
  @DisplayName("Should answer a range request with partial content")
  void shouldServeByteRange() throws Exception {
    when(documentService.getContent("FORMS_MASTER:1"))
        .thenReturn(new DocumentContent(meta(), PDF_BYTES));

    mockMvc
        .perform(get("/api/document/{id}/proxy", "FORMS_MASTER:1").header("Range", "bytes=0-3"))
        .andExpect(status().isPartialContent())
        .andExpect(header().string(HttpHeaders.CONTENT_RANGE, "bytes 0-3/" + PDF_BYTES.length))
        .andExpect(content().bytes("%PDF".getBytes(StandardCharsets.US_ASCII)));
  }

  @Test
  @DisplayName("Should download as attachment by default")
  void shouldDownloadAsAttachment() throws Exception {
    when(documentService.getContent("FORMS_MASTER:1"))
        .thenReturn(new DocumentContent(meta(), PDF_BYTES));

    mockMvc
        .perform(get("/api/document/{id}/download", "FORMS_MASTER:1"))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("attachment")))
        .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("safety.pdf")));
  }

  @Test
  @DisplayName("Should download inline when requested")
  void shouldDownloadInline() throws Exception {
    when(documentService.getContent("FORMS_MASTER:1"))
        .thenReturn(new DocumentContent(meta(), PDF_BYTES));

    mockMvc
        .perform(get("/api/document/{id}/download", "FORMS_MASTER:1").param("inline", "true"))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("inline")));
  }

  @Test
  @DisplayName("Should fall back to octet-stream for an invalid stored type")
  void shouldFallBackForInvalidMimeType() throws Exception {
    DocumentMeta odd = meta().toBuilder().mimeType("not a type").build();
    when(documentService.getContent("FORMS_MASTER:1"))
        .thenReturn(new DocumentContent(odd, PDF_BYTES));

    mockMvc
        .perform(get("/api/document/{id}/download", "FORMS_MASTER:1"))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "application/octet-stream"));
  }

  @Test
  @DisplayName("Should return 404 when content is missing")
  void shouldReturnNotFoundForMissingContent() throws Exception {
    when(documentService.getContent("FORMS_MASTER:1"))
        .thenThrow(new DocumentNotFoundException("FORMS_MASTER:1", "File content not found"));

    mockMvc
        .perform(get("/api/document/{id}/download", "FORMS_MASTER:1"))
        .andExpect(status().isNotFound());
  }

  private static DocumentMeta meta() {
    return DocumentMeta.builder()
        .id("FORMS_MASTER:1")
        .sourceTable("FORMS_MASTER")
        .rowId("1")
        .name("safety.pdf")
        .title("Safety Manual")
        .mimeType("application/pdf")
        .sizeBytes(PDF_BYTES.length)
        .path("SOP/HSE/safety.pdf")
        .metadata(Map.of("department", "HSE"))
        .build();
  }
}
