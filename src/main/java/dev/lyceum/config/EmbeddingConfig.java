package dev.lyceum.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Configures the embedding model and the lecture passage vector store.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running
 * in-process, avoiding any external embedding API. The {@link PgVectorEmbeddingStore}
 * shares the application's HikariCP {@link DataSource} to avoid duplicate connection pools.
 *
 * @see dev.lyceum.search.EmbeddingStoreRetriever
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /**
     * Configures the pgvector store holding transcript passages.
     *
     * <p>Schema and HNSW index are managed by Flyway; {@code createTable} and {@code useIndex}
     * are disabled to avoid conflicts. Metadata uses the store's default single JSON column.
     *
     * @param dataSource the shared HikariCP data source (no duplicate pool)
     * @param table      the passage table name
     * @return an embedding store backed by pgvector
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(
            DataSource dataSource,
            @Value("${lyceum.embedding.table:lecture_chunks}") String table) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(table)
                .dimension(384)
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)    // HNSW index managed by Flyway V1
                .build();
    }
}
