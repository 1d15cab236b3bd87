package com.flamingo.ai.docsearch.domain.model;

/**
 * Binary content of a document together with its metadata.
 *
 * @param meta document metadata
 * @param content raw bytes as stored
 */
public record DocumentContent(DocumentMeta meta, byte[] content) {}
