package com.flamingo.ai.docsearch.domain.model;

import java.util.List;

/**
 * A window over the documents of all source tables.
 *
 * @param documents documents of the window
 * @param total number of documents across all tables
 * @param limit window size
 * @param offset window start
 */
public record DocumentPage(List<DocumentMeta> documents, int total, int limit, int offset) {}
