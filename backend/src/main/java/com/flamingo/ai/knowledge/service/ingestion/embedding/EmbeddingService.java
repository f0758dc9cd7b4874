package com.flamingo.ai.knowledge.service.ingestion.embedding;

import com.flamingo.ai.knowledge.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates text embeddings with the configured embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; dense CJK text can approach one token per char
  private static final int MAX_CHARS_PER_EMBEDDING = 8000;
  private static final int MAX_INPUTS_PER_REQUEST = 100;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a search query.
   *
   * @param query the query text
   * @return embedding vector, or an empty list if the query is blank or the provider fails
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  public List<Float> embedQuery(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    Response<Embedding> response = embeddingModel.embed(truncate(query));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    List<Float> vector = toFloatList(response.content());
    return vector != null ? vector : List.of();
  }

  /**
   * Embeds chunk texts in one logical batch.
   *
   * <p>The result is aligned with the input: element {@code i} is the vector for text {@code i},
   * or {@code null} when that text is blank or the provider returned no vector for it.
   *
   * @param texts texts to embed
   * @return one entry per input, in input order
   * @throws EmbeddingException if the provider call itself fails
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai")
  public List<List<Float>> embedBatch(List<String> texts) {
    List<List<Float>> results = new ArrayList<>(texts.size());
    List<Integer> positions = new ArrayList<>();
    List<TextSegment> segments = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      results.add(null);
      String text = texts.get(i);
      if (text != null && !text.isBlank()) {
        positions.add(i);
        segments.add(TextSegment.from(truncate(text)));
      }
    }

    try {
      for (int from = 0; from < segments.size(); from += MAX_INPUTS_PER_REQUEST) {
        int to = Math.min(from + MAX_INPUTS_PER_REQUEST, segments.size());
        List<Embedding> embeddings = embeddingModel.embedAll(segments.subList(from, to)).content();
        for (int j = 0; j < embeddings.size() && from + j < to; j++) {
          results.set(positions.get(from + j), toFloatList(embeddings.get(j)));
        }
      }
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
      log.error("Batch embedding of {} texts failed: {}", segments.size(), e.getMessage());
      throw new EmbeddingException("Embedding generation failed: " + e.getMessage(), e);
    }

    long missing = results.stream().filter(v -> v == null).count();
    if (missing > 0) {
      log.warn("{} of {} texts have no embedding", missing, texts.size());
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    return results;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed, returning empty vector: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    return List.of();
  }

  private static String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  /** Converts a vector to a Float list; an empty vector counts as missing. */
  private static List<Float> toFloatList(Embedding embedding) {
    if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
      return null;
    }
    float[] vector = embedding.vector();
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
