package com.flamingo.ai.docsearch.source;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.domain.identity.DocumentIdentity;
import com.flamingo.ai.docsearch.domain.identity.DocumentIdentityCodec;
import com.flamingo.ai.docsearch.domain.model.DocumentMeta;
import com.flamingo.ai.docsearch.exception.DocumentNotFoundException;
import com.flamingo.ai.docsearch.exception.MalformedIdentityException;
import com.flamingo.ai.docsearch.exception.SourceStoreUnavailableException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TypeMismatchDataAccessException;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link SourceStoreGateway} over JDBC.
 *
 * <p>Table and column names come from {@link DocSearchConfig.Table}; they are validated as plain
 * SQL identifiers at startup because they are concatenated into statements. Row ids are always
 * bound as parameters.
 */
@Repository
@Slf4j
public class JdbcSourceStoreGateway implements SourceStoreGateway {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final String DEFAULT_MIME_TYPE = MediaType.APPLICATION_OCTET_STREAM_VALUE;

  private final JdbcTemplate jdbc;
  private final DocumentIdentityCodec identityCodec;
  private final Map<String, TableQueries> queries = new LinkedHashMap<>();

  public JdbcSourceStoreGateway(
      JdbcTemplate jdbc, DocumentIdentityCodec identityCodec, DocSearchConfig config) {
    this.jdbc = jdbc;
    this.identityCodec = identityCodec;
    String sizeFunction = requireIdentifier(config.getSource().getSizeFunction(), "size function");
    config
        .getTables()
        .forEach(
            (table, schema) -> queries.put(table, new TableQueries(table, schema, sizeFunction)));
  }

  @Override
  public List<String> configuredTables() {
    return List.copyOf(queries.keySet());
  }

  @Override
  public List<DocumentMeta> listDocuments(String table) {
    TableQueries tableQueries = queriesFor(table);
    List<DocumentMeta> documents = new ArrayList<>();
    try {
      jdbc.query(
          tableQueries.listSql,
          rs -> {
            try {
              documents.add(tableQueries.mapRow(rs));
            } catch (MalformedIdentityException e) {
              log.warn("Skipping row of {} with unusable id: {}", table, e.getMessage());
            }
          });
      log.info("Found {} documents in {}", documents.size(), table);
      return documents;
    } catch (DataAccessException e) {
      throw new SourceStoreUnavailableException(
          "Failed to list documents of " + table + ": " + e.getMessage(), e);
    }
  }

  @Override
  public byte[] fetchBlob(String documentId) {
    DocumentIdentity identity = identityCodec.decode(documentId);
    TableQueries tableQueries = queriesFor(identity.table());
    byte[] content;
    try {
      content =
          jdbc.query(
              tableQueries.blobSql, rs -> rs.next() ? rs.getBytes(1) : null, identity.rowId());
    } catch (DataIntegrityViolationException | TypeMismatchDataAccessException e) {
      log.debug("Row id of {} does not convert to the key type: {}", documentId, e.getMessage());
      throw new DocumentNotFoundException(documentId);
    } catch (DataAccessException e) {
      throw new SourceStoreUnavailableException(
          "Failed to fetch content of " + documentId + ": " + e.getMessage(), e);
    }
    if (content == null) {
      throw new DocumentNotFoundException(documentId, "Document has no content: " + documentId);
    }
    return content;
  }

  @Override
  public Optional<DocumentMeta> findDocument(String documentId) {
    DocumentIdentity identity = identityCodec.decode(documentId);
    TableQueries tableQueries = queriesFor(identity.table());
    try {
      List<DocumentMeta> rows =
          jdbc.query(
              tableQueries.findSql, (rs, rowNum) -> tableQueries.mapRow(rs), identity.rowId());
      return rows.stream().findFirst();
    } catch (DataIntegrityViolationException | TypeMismatchDataAccessException e) {
      // a row id the key column cannot hold names no row
      log.debug("Row id of {} does not convert to the key type: {}", documentId, e.getMessage());
      return Optional.empty();
    } catch (DataAccessException e) {
      throw new SourceStoreUnavailableException(
          "Failed to look up " + documentId + ": " + e.getMessage(), e);
    }
  }

  @Override
  public String testConnection() {
    try {
      return jdbc.execute(
          (ConnectionCallback<String>)
              connection ->
                  connection.getMetaData().getDatabaseProductName()
                      + " "
                      + connection.getMetaData().getDatabaseProductVersion());
    } catch (DataAccessException e) {
      throw new SourceStoreUnavailableException(
          "Source store connection test failed: " + e.getMessage(), e);
    }
  }

  private TableQueries queriesFor(String table) {
    TableQueries tableQueries = queries.get(table);
    if (tableQueries == null) {
      throw new IllegalArgumentException("Unknown source table: " + table);
    }
    return tableQueries;
  }

  private static String requireIdentifier(String value, String label) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new IllegalStateException("Invalid " + label + " in configuration: " + value);
    }
    return value;
  }

  private static String optionalColumn(String column, String alias) {
    return column == null || column.isBlank() ? "NULL AS " + alias : column + " AS " + alias;
  }

  /** Statements and row mapping for one configured table. */
  private final class TableQueries {

    private final String table;
    private final List<String> metadataAttributes = new ArrayList<>();
    private final PathTemplate pathTemplate;
    private final String listSql;
    private final String findSql;
    private final String blobSql;

    TableQueries(String table, DocSearchConfig.Table schema, String sizeFunction) {
      this.table = requireIdentifier(table, "table name");
      String idColumn = requireIdentifier(schema.getIdColumn(), table + " id column");
      String nameColumn = requireIdentifier(schema.getNameColumn(), table + " name column");
      String contentColumn =
          requireIdentifier(schema.getContentColumn(), table + " content column");

      List<String> select = new ArrayList<>();
      select.add(idColumn + " AS doc_id");
      select.add(nameColumn + " AS doc_name");
      select.add(optionalColumn(checked(schema.getTypeColumn()), "mime_type"));
      select.add(optionalColumn(checked(schema.getTitleColumn()), "doc_title"));
      select.add(optionalColumn(checked(schema.getFormNoColumn()), "form_no"));
      select.add(optionalColumn(checked(schema.getUpdateColumn()), "modified_time"));
      select.add(sizeFunction + "(" + contentColumn + ") AS size_bytes");
      int index = 0;
      for (Map.Entry<String, String> entry : schema.getMetadataColumns().entrySet()) {
        metadataAttributes.add(entry.getKey());
        String column = requireIdentifier(entry.getValue(), table + " metadata column");
        select.add(column + " AS meta_" + index++);
      }

      String base = "SELECT " + String.join(", ", select) + " FROM " + table;
      String activeColumn = checked(schema.getActiveColumn());
      String updateColumn = checked(schema.getUpdateColumn());
      StringBuilder list = new StringBuilder(base).append(" WHERE ");
      if (activeColumn != null) {
        list.append(activeColumn).append(" = 1 AND ");
      }
      list.append(contentColumn).append(" IS NOT NULL AND ");
      list.append(nameColumn).append(" IS NOT NULL");
      if (updateColumn != null) {
        list.append(" ORDER BY ").append(updateColumn).append(" DESC");
      }
      this.listSql = list.toString();
      this.findSql = base + " WHERE " + idColumn + " = ?";
      this.blobSql = "SELECT " + contentColumn + " FROM " + table + " WHERE " + idColumn + " = ?";
      this.pathTemplate = new PathTemplate(schema.getPathTemplate());
    }

    private String checked(String column) {
      if (column == null || column.isBlank()) {
        return null;
      }
      return requireIdentifier(column, table + " column");
    }

    DocumentMeta mapRow(ResultSet rs) throws SQLException {
      String rowId = rs.getString("doc_id");
      String name = nullToEmpty(rs.getString("doc_name"));
      String title = rs.getString("doc_title");
      String formNo = rs.getString("form_no");
      String mimeType = rs.getString("mime_type");
      Timestamp modified = rs.getTimestamp("modified_time");

      Map<String, String> metadata = new LinkedHashMap<>();
      for (int i = 0; i < metadataAttributes.size(); i++) {
        String value = rs.getString("meta_" + i);
        if (value != null) {
          metadata.put(metadataAttributes.get(i), value);
        }
      }

      Map<String, String> pathAttributes = new HashMap<>(metadata);
      pathAttributes.put("name", name);
      pathAttributes.put("rowId", rowId);
      if (formNo != null) {
        pathAttributes.put("formNo", formNo);
      }

      return DocumentMeta.builder()
          .id(identityCodec.encode(table, rowId))
          .sourceTable(table)
          .rowId(rowId)
          .name(name)
          .title(title == null || title.isBlank() ? name : title)
          .formNo(formNo)
          .mimeType(
              mimeType == null || !mimeType.contains("/")
                  ? mimeTypeFromName(name)
                  : mimeType.trim())
          .sizeBytes(rs.getLong("size_bytes"))
          .modifiedTime(modified == null ? null : modified.toInstant())
          .path(pathTemplate.render(pathAttributes))
          .metadata(Map.copyOf(metadata))
          .build();
    }
  }

  static String mimeTypeFromName(String name) {
    return MediaTypeFactory.getMediaType(name).map(MediaType::toString).orElse(DEFAULT_MIME_TYPE);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
