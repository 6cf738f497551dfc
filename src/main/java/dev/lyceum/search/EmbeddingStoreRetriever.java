package dev.lyceum.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * {@link VectorRetriever} over a LangChain4j {@link EmbeddingStore} (pgvector table {@code
 * lecture_chunks}) using the in-process bge-small-en-v1.5 embedding model.
 *
 * <p>Segment metadata written at ingestion time is mapped onto {@link PassageMetadata}: {@code
 * season}, comma-separated {@code types_discussed} and {@code functions_covered}, and {@code
 * content_type}. The citation label is {@code source_label}, falling back to {@code filename}.
 *
 * <p>A {@link RetrievalFilter} becomes a store-side metadata filter: {@code types_discussed} must
 * contain one of the types (codes are stored upper case) and {@code season} must equal the season.
 */
@Component
public class EmbeddingStoreRetriever implements VectorRetriever {

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries only, never to indexed passages.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  static final String UNKNOWN_SOURCE = "Unknown source";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;

  public EmbeddingStoreRetriever(
      EmbeddingStore<TextSegment> embeddingStore, EmbeddingModel embeddingModel) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
  }

  @Override
  public List<RetrievedPassage> search(String query, int topK) {
    return search(query, topK, RetrievalFilter.NONE);
  }

  @Override
  public List<RetrievedPassage> search(String query, int topK, RetrievalFilter filter) {
    Embedding queryEmbedding = embeddingModel.embed(BGE_QUERY_PREFIX + query).content();
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding).maxResults(topK);

    Filter metadataFilter = buildFilter(filter);
    if (metadataFilter != null) {
      builder.filter(metadataFilter);
    }
    EmbeddingSearchRequest request = builder.build();

    List<RetrievedPassage> hits = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : embeddingStore.search(request).matches()) {
      if (match.embedded() != null) {
        hits.add(toPassage(match));
      }
    }
    return hits;
  }

  /**
   * Builds the store filter: any of the types, and the season, each only when present.
   *
   * @return the combined filter, or {@code null} when nothing restricts the search
   */
  static @Nullable Filter buildFilter(RetrievalFilter filter) {
    List<Filter> filters = new ArrayList<>();

    filter.types().stream()
        .<Filter>map(type -> metadataKey("types_discussed").containsString(type))
        .reduce((a, b) -> a.or(b))
        .ifPresent(filters::add);

    Integer season = filter.season();
    if (season != null) {
      filters.add(metadataKey("season").isEqualTo(season.intValue()));
    }

    return filters.stream().reduce((a, b) -> a.and(b)).orElse(null);
  }

  static RetrievedPassage toPassage(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Metadata metadata = segment.metadata();
    double score = Math.max(0.0, Math.min(1.0, match.score()));
    return new RetrievedPassage(
        segment.text(),
        blankToNull(string(metadata, "source_id")),
        sourceLabel(metadata),
        integer(metadata, "chunk_offset"),
        new PassageMetadata(
            integer(metadata, "season"),
            codes(metadata, "types_discussed", true),
            codes(metadata, "functions_covered", false),
            nullToEmpty(string(metadata, "content_type")).toLowerCase(Locale.ROOT)),
        score);
  }

  private static String sourceLabel(Metadata metadata) {
    String label = blankToNull(string(metadata, "source_label"));
    if (label == null) {
      label = blankToNull(string(metadata, "filename"));
    }
    return label == null ? UNKNOWN_SOURCE : label;
  }

  private static @Nullable String string(Metadata metadata, String key) {
    Object value = metadata.toMap().get(key);
    return value == null ? null : value.toString();
  }

  /** Reads an integer stored either as a number or as a numeric string. */
  private static @Nullable Integer integer(Metadata metadata, String key) {
    Object value = metadata.toMap().get(key);
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return (int) Double.parseDouble(text.strip());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Set<String> codes(Metadata metadata, String key, boolean upperCase) {
    String raw = string(metadata, key);
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    Set<String> codes = new LinkedHashSet<>();
    Arrays.stream(raw.split("[,;]"))
        .map(String::strip)
        .filter(code -> !code.isEmpty())
        .map(code -> upperCase ? code.toUpperCase(Locale.ROOT) : functionCase(code))
        .forEach(codes::add);
    return codes;
  }

  /** Function codes are stored as {@code Ni}, {@code Te}: upper-case letter, lower-case letter. */
  private static String functionCase(String code) {
    return code.substring(0, 1).toUpperCase(Locale.ROOT) + code.substring(1).toLowerCase(Locale.ROOT);
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value;
  }

  private static String nullToEmpty(@Nullable String value) {
    return value == null ? "" : value;
  }
}
