package com.flamingo.ai.docsearch.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for source tables, indexing runs, extraction and search. */
@Configuration
@ConfigurationProperties(prefix = "docsearch")
@Getter
@Setter
public class DocSearchConfig {

  /** Source tables keyed by table name, in indexing order. */
  private Map<String, Table> tables = new LinkedHashMap<>();

  private Source source = new Source();
  private Index index = new Index();
  private Indexing indexing = new Indexing();
  private Extraction extraction = new Extraction();
  private Search search = new Search();

  /** Column mapping for one relational table that holds documents. */
  @Getter
  @Setter
  public static class Table {
    private String idColumn;
    private String nameColumn;
    private String typeColumn;
    private String titleColumn;
    private String contentColumn;
    private String updateColumn;
    private String formNoColumn;

    /** Boolean column that marks live rows; rows are not filtered when empty. */
    private String activeColumn = "IsActive";

    /** Metadata attribute name to column name. */
    private Map<String, String> metadataColumns = new LinkedHashMap<>();

    /**
     * Category path built from placeholders, e.g. {@code {form_type}/{department|General}/{name}}.
     * A placeholder names a metadata attribute or {@code name}; {@code |} gives a default.
     */
    private String pathTemplate = "{name}";
  }

  @Getter
  @Setter
  public static class Source {
    /** SQL function returning the byte length of a blob column. */
    private String sizeFunction = "DATALENGTH";
  }

  @Getter
  @Setter
  public static class Index {
    private String name = "documents";
    private String textAnalyzer = "standard";
  }

  @Getter
  @Setter
  public static class Indexing {
    private int batchSize = 50;
    private int workerThreads = 4;
    private Duration documentTimeout = Duration.ofMinutes(2);

    /** Index documents whose extraction produced no text; they stay searchable by metadata. */
    private boolean indexEmptyContent = true;
  }

  @Getter
  @Setter
  public static class Extraction {
    private int maxTextLength = 50_000;
  }

  @Getter
  @Setter
  public static class Search {
    private int defaultLimit = 20;
    private int maxLimit = 100;
    private int cropLength = 200;
    private int defaultListingLimit = 100;
  }
}
