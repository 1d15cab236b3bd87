package com.flamingo.ai.docsearch.source;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Category path pattern such as {@code {form_type}/{department|General}/{name}}.
 *
 * <p>Each placeholder is replaced by the named attribute; the text after {@code |} is used when
 * the attribute is missing or blank. A missing attribute without a default renders as empty.
 */
final class PathTemplate {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}|]+)(?:\\|([^{}]*))?}");

  private final String template;

  PathTemplate(String template) {
    this.template = template;
  }

  String render(Map<String, String> attributes) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String value = attributes.get(matcher.group(1).trim());
      if (value == null || value.isBlank()) {
        value = matcher.group(2) != null ? matcher.group(2) : "";
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
