package com.flamingo.ai.docsearch.domain.identity;

/**
 * Decoded form of a composite document identity.
 *
 * @param table source table name
 * @param rowId table-local row id
 */
public record DocumentIdentity(String table, String rowId) {

  /** Separates the table name from the row id; never part of either component. */
  public static final char DELIMITER = ':';

  /** Returns the composite string form, {@code <table>:<rowId>}. */
  public String asString() {
    return table + DELIMITER + rowId;
  }

  @Override
  public String toString() {
    return asString();
  }
}
