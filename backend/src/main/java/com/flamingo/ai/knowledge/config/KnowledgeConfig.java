package com.flamingo.ai.knowledge.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline and retrieval. */
@Configuration
@ConfigurationProperties(prefix = "knowledge")
@Getter
@Setter
public class KnowledgeConfig {

  private Chunking chunking = new Chunking();
  private Processing processing = new Processing();
  private Search search = new Search();
  private Storage storage = new Storage();

  @Getter
  @Setter
  public static class Chunking {
    /** Soft upper bound on generic chunk size, in characters. */
    private int maxChunkSize = 1000;

    private int minChunkSize = 100;

    /** Words carried from the end of one chunk into the next. */
    private int overlapWords = 40;

    /** Size at which a code chunk is flushed without a boundary. */
    private int codeChunkSize = 500;

    /** Minimum lines a code chunk holds before a boundary may split it. */
    private int codeMinLines = 5;

    private int rowsPerChunk = 20;
  }

  @Getter
  @Setter
  public static class Processing {
    private int insertBatchSize = 50;
    private long maxFileSizeBytes = 50L * 1024 * 1024;
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
  }

  @Getter
  @Setter
  public static class Search {
    private int defaultLimit = 10;
    private double minSimilarity = 0.7;
    private int contextMaxTokens = 4000;
    private double contextMinSimilarity = 0.6;
    private int rrfK = 60;
    private int candidatesMultiplier = 3;
  }

  @Getter
  @Setter
  public static class Storage {
    private String basePath = "./data/documents";

    /** Content types the blob store accepts. Empty means everything is accepted. */
    private List<String> allowedContentTypes = new ArrayList<>();
  }
}
