package com.flamingo.ai.docsearch.domain.model;

/**
 * Cleaned text of one page of a paginated document.
 *
 * @param page 1-based page number
 * @param text page text
 */
public record PageText(int page, String text) {}
