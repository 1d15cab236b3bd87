package com.flamingo.ai.docsearch.domain.identity;

import com.flamingo.ai.docsearch.config.DocSearchConfig;
import com.flamingo.ai.docsearch.exception.MalformedIdentityException;
import com.google.common.annotations.VisibleForTesting;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Encodes and decodes composite identities {@code <source-table>:<row-id>}.
 *
 * <p>One flat index holds rows from several tables, so the table name is part of every id. The
 * delimiter is rejected inside either component and tables must be configured, which makes the
 * mapping injective: two different (table, row) pairs never share an id.
 */
@Component
public class DocumentIdentityCodec {

  private final Set<String> tables;

  @Autowired
  public DocumentIdentityCodec(DocSearchConfig config) {
    this(config.getTables().keySet());
  }

  @VisibleForTesting
  public DocumentIdentityCodec(Collection<String> tables) {
    this.tables = Set.copyOf(new LinkedHashSet<>(tables));
  }

  /**
   * Builds the composite id for a row.
   *
   * @throws MalformedIdentityException if a component is blank, contains the delimiter, or the
   *     table is not configured
   */
  public String encode(String table, String rowId) {
    String candidate = table + DocumentIdentity.DELIMITER + rowId;
    validateComponent(candidate, table, "table name");
    validateComponent(candidate, rowId, "row id");
    requireConfigured(candidate, table);
    return candidate;
  }

  /**
   * Splits a composite id into table and row id.
   *
   * @throws MalformedIdentityException if the id does not hold exactly one delimiter, a component
   *     is blank, or the table is not configured
   */
  public DocumentIdentity decode(String id) {
    if (id == null || id.isBlank()) {
      throw new MalformedIdentityException(String.valueOf(id), "identity is empty");
    }
    int split = id.indexOf(DocumentIdentity.DELIMITER);
    if (split < 0) {
      throw new MalformedIdentityException(
          id, "missing '" + DocumentIdentity.DELIMITER + "' delimiter");
    }
    if (id.indexOf(DocumentIdentity.DELIMITER, split + 1) >= 0) {
      throw new MalformedIdentityException(
          id, "more than one '" + DocumentIdentity.DELIMITER + "' delimiter");
    }
    String table = id.substring(0, split);
    String rowId = id.substring(split + 1);
    if (table.isBlank()) {
      throw new MalformedIdentityException(id, "table name is empty");
    }
    if (rowId.isBlank()) {
      throw new MalformedIdentityException(id, "row id is empty");
    }
    requireConfigured(id, table);
    return new DocumentIdentity(table, rowId);
  }

  public boolean isConfigured(String table) {
    return tables.contains(table);
  }

  private void validateComponent(String candidate, String value, String label) {
    if (value == null || value.isBlank()) {
      throw new MalformedIdentityException(candidate, label + " is empty");
    }
    if (value.indexOf(DocumentIdentity.DELIMITER) >= 0) {
      throw new MalformedIdentityException(
          candidate, label + " contains '" + DocumentIdentity.DELIMITER + "'");
    }
  }

  private void requireConfigured(String candidate, String table) {
    if (!tables.contains(table)) {
      throw new MalformedIdentityException(
          candidate, "unknown source table '" + table + "'", true);
    }
  }
}
