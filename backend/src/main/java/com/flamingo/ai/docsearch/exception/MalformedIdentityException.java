package com.flamingo.ai.docsearch.exception;

/** Exception thrown when a composite document identity cannot be encoded or decoded. */
public class MalformedIdentityException extends RuntimeException {

  private final String identity;
  private final boolean unknownTable;

  public MalformedIdentityException(String identity, String reason) {
    this(identity, reason, false);
  }

  public MalformedIdentityException(String identity, String reason, boolean unknownTable) {
    super("Malformed document identity '" + identity + "': " + reason);
    this.identity = identity;
    this.unknownTable = unknownTable;
  }

  public String getIdentity() {
    return identity;
  }

  /** Whether the identity is well-formed but names a table that is not configured. */
  public boolean isUnknownTable() {
    return unknownTable;
  }
}
