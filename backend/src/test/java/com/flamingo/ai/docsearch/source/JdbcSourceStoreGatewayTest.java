package com.flamingo.ai.docsearch.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.identity.DocumentIdentityCodec;
import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.exception.DocumentNotFoundException;
import com.flamingo.ai.docsearch.exception.MalformedIdentityException;
import com.flamingo.ai.docsearch.exception.SourceStoreUnavailableException;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

@DisplayName("JdbcSourceStoreGateway Tests")
class JdbcSourceStoreGatewayTest {

  private JdbcTemplate jdbc;
  private DocSearchConfig config;
  private JdbcSourceStoreGateway gateway;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource =
        new DriverManagerDataSource(
            "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MSSQLServer;DB_CLOSE_DELAY=-1", "sa", "");
    jdbc = new JdbcTemplate(dataSource);
    jdbc.execute(
        "CREATE TABLE FORMS_MASTER (FORMS_MASTER_ID INT PRIMARY KEY, DOCFILE_NAME VARCHAR(255),"
            + " DOCFILE_TYPE VARCHAR(100), TITLE VARCHAR(255), DOCFILE_CONTENT VARBINARY(10000),"
            + " UpdateDate TIMESTAMP, FORM_NO VARCHAR(50), FORM_TYPE VARCHAR(50),"
            + " DEPARTMENT_ID VARCHAR(50), IsActive TINYINT)");
    jdbc.execute(
        "CREATE TABLE VESSEL_CERTIFICATES (VESSEL_CERTIFICATES_ID VARCHAR(50) PRIMARY KEY,"
            + " CERTIFICATE_NAME VARCHAR(255), CERTIFICATE_CONTENT VARBINARY(10000),"
            + " VESSEL_ID VARCHAR(50))");

    insertForm(1, "safety.pdf", "application/pdf", "Safety Manual", "pdf-bytes", "2024-01-01", 1);
    insertForm(2, "newest.docx", null, null, "docx-bytes", "2024-06-01", 1);
    insertForm(3, "retired.txt", "text/plain", "Retired", "old", "2024-03-01", 0);
    insertForm(4, "empty.txt", "text/plain", "Empty", null, "2024-02-01", 1);
    jdbc.update(
        "INSERT INTO VESSEL_CERTIFICATES VALUES (?, ?, ?, ?)",
        "77",
        "class.txt",
        bytes("certificate"),
        "IMO-9");
    jdbc.update(
        "INSERT INTO VESSEL_CERTIFICATES VALUES (?, ?, ?, ?)",
        "a:b",
        "bad-id.txt",
        bytes("x"),
        "IMO-9");

    config = new DocSearchConfig();
    config.getSource().setSizeFunction("OCTET_LENGTH");
    config.getTables().put("FORMS_MASTER", formsTable());
    config.getTables().put("VESSEL_CERTIFICATES", vesselTable());
    gateway = newGateway();
  }

  @Test
  void shouldListTablesInConfiguredOrder() {
    assertThat(gateway.configuredTables()).containsExactly("FORMS_MASTER", "VESSEL_CERTIFICATES");
  }

  @Test
  void shouldListActiveRowsWithContentNewestFirst() {
    List<DocumentMeta> documents = gateway.listDocuments("FORMS_MASTER");

    assertThat(documents)
        .extracting(DocumentMeta::getId)
        .containsExactly("FORMS_MASTER:2", "FORMS_MASTER:1");
  }

  @Test
  void shouldMapRowToMetadata() {
    DocumentMeta safety =
        gateway.listDocuments("FORMS_MASTER").stream()
            .filter(d -> d.getRowId().equals("1"))
            .findFirst()
            .orElseThrow();

    assertThat(safety.getSourceTable()).isEqualTo("FORMS_MASTER");
    assertThat(safety.getName()).isEqualTo("safety.pdf");
    assertThat(safety.getTitle()).isEqualTo("Safety Manual");
    assertThat(safety.getFormNo()).isEqualTo("F-1");
    assertThat(safety.getMimeType()).isEqualTo("application/pdf");
    assertThat(safety.getSizeBytes()).isEqualTo("pdf-bytes".length());
    assertThat(safety.getModifiedTime()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(safety.getMetadata()).isEqualTo(Map.of("form_type", "SOP", "department", "HSE"));
    assertThat(safety.getPath()).isEqualTo("SOP/HSE/safety.pdf");
  }

  @Test
  void shouldFallBackForMissingTitleAndMimeType() {
    DocumentMeta newest = gateway.findDocument("FORMS_MASTER:2").orElseThrow();

    assertThat(newest.getTitle()).isEqualTo("newest.docx");
    assertThat(newest.getMimeType()).isNotBlank().isNotEqualTo("application/pdf");
  }

  @Test
  void shouldDeriveMimeTypeWhenStoredTypeIsNotAMediaType() {
    insertForm(9, "scan.pdf", "PDF", "Scan", "pdf-bytes", "2023-01-01", 0);

    DocumentMeta scan = gateway.findDocument("FORMS_MASTER:9").orElseThrow();

    assertThat(scan.getMimeType()).isEqualTo("application/pdf");
  }

  @Test
  void shouldUseDefaultPathSegmentWhenAttributeIsMissing() {
    jdbc.update("UPDATE FORMS_MASTER SET DEPARTMENT_ID = NULL WHERE FORMS_MASTER_ID = 1");

    DocumentMeta safety = gateway.findDocument("FORMS_MASTER:1").orElseThrow();

    assertThat(safety.getPath()).isEqualTo("SOP/General/safety.pdf");
    assertThat(safety.getMetadata()).doesNotContainKey("department");
  }

  @Test
  void shouldSkipRowsWhoseIdContainsDelimiter() {
    List<DocumentMeta> documents = gateway.listDocuments("VESSEL_CERTIFICATES");

    assertThat(documents).extracting(DocumentMeta::getId).containsExactly("VESSEL_CERTIFICATES:77");
    assertThat(documents.get(0).getPath()).isEqualTo("Certificates/Vessel/IMO-9/class.txt");
    assertThat(documents.get(0).getModifiedTime()).isNull();
  }

  @Test
  void shouldFetchBlob() {
    assertThat(gateway.fetchBlob("VESSEL_CERTIFICATES:77")).isEqualTo(bytes("certificate"));
  }

  @Test
  void shouldThrowNotFoundForMissingRowOrContent() {
    assertThatThrownBy(() -> gateway.fetchBlob("FORMS_MASTER:999"))
        .isInstanceOf(DocumentNotFoundException.class);
    assertThatThrownBy(() -> gateway.fetchBlob("FORMS_MASTER:4"))
        .isInstanceOf(DocumentNotFoundException.class)
        .hasMessageContaining("no content");
  }

  @Test
  void shouldTreatNonNumericIdOnIntegerKeyAsMissing() {
    assertThat(gateway.findDocument("FORMS_MASTER:abc")).isEmpty();
    assertThatThrownBy(() -> gateway.fetchBlob("FORMS_MASTER:abc"))
        .isInstanceOf(DocumentNotFoundException.class)
        .isNotInstanceOf(SourceStoreUnavailableException.class);
  }

  @Test
  void shouldRejectMalformedIdentity() {
    assertThatThrownBy(() -> gateway.fetchBlob("FORMS_MASTER"))
        .isInstanceOf(MalformedIdentityException.class);
    assertThatThrownBy(() -> gateway.findDocument("UNKNOWN:1"))
        .isInstanceOf(MalformedIdentityException.class);
  }

  @Test
  void shouldFindInactiveRowById() {
    assertThat(gateway.findDocument("FORMS_MASTER:3")).isPresent();
    assertThat(gateway.findDocument("FORMS_MASTER:999")).isEmpty();
  }

  @Test
  void shouldReportDatabaseProduct() {
    assertThat(gateway.testConnection()).startsWith("H2");
  }

  @Test
  void shouldWrapDatabaseErrors() {
    jdbc.execute("DROP TABLE VESSEL_CERTIFICATES");

    assertThatThrownBy(() -> gateway.listDocuments("VESSEL_CERTIFICATES"))
        .isInstanceOf(SourceStoreUnavailableException.class);
  }

  @Test
  void shouldRejectUnsafeIdentifiersInConfiguration() {
    config.getTables().get("FORMS_MASTER").setNameColumn("DOCFILE_NAME; DROP TABLE X");

    assertThatThrownBy(this::newGateway).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldDeriveMimeTypeFromFileName() {
    assertThat(JdbcSourceStoreGateway.mimeTypeFromName("a.pdf")).isEqualTo("application/pdf");
    assertThat(JdbcSourceStoreGateway.mimeTypeFromName("a.unknownext"))
        .isEqualTo("application/octet-stream");
  }

  private JdbcSourceStoreGateway newGateway() {
    return new JdbcSourceStoreGateway(jdbc, new DocumentIdentityCodec(config), config);
  }

  private void insertForm(
      int id, String name, String type, String title, String content, String date, int active) {
    jdbc.update(
        "INSERT INTO FORMS_MASTER VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
        id,
        name,
        type,
        title,
        content == null ? null : bytes(content),
        Timestamp.from(Instant.parse(date + "T00:00:00Z")),
        "F-" + id,
        "SOP",
        "HSE",
        active);
  }

  private static DocSearchConfig.Table formsTable() {
    DocSearchConfig.Table table = new DocSearchConfig.Table();
    table.setIdColumn("FORMS_MASTER_ID");
    table.setNameColumn("DOCFILE_NAME");
    table.setTypeColumn("DOCFILE_TYPE");
    table.setTitleColumn("TITLE");
    table.setContentColumn("DOCFILE_CONTENT");
    table.setUpdateColumn("UpdateDate");
    table.setFormNoColumn("FORM_NO");
    table.setActiveColumn("IsActive");
    table.getMetadataColumns().put("form_type", "FORM_TYPE");
    table.getMetadataColumns().put("department", "DEPARTMENT_ID");
    table.setPathTemplate("{form_type}/{department|General}/{name}");
    return table;
  }

  private static DocSearchConfig.Table vesselTable() {
    DocSearchConfig.Table table = new DocSearchConfig.Table();
    table.setIdColumn("VESSEL_CERTIFICATES_ID");
    table.setNameColumn("CERTIFICATE_NAME");
    table.setContentColumn("CERTIFICATE_CONTENT");
    table.setActiveColumn("");
    table.getMetadataColumns().put("vessel_id", "VESSEL_ID");
    table.setPathTemplate("Certificates/Vessel/{vessel_id}/{name}");
    return table;
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
