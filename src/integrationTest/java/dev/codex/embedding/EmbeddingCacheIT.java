package dev.codex.embedding;

import dev.codex.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingCacheIT extends BaseIntegrationTest {

    @Autowired
    EmbeddingCache embeddingCache;

    @Autowired
    EmbeddingCacheRepository cacheRepository;

    @Autowired
    EmbeddingProvider embeddingProvider;

    private static String unique(String text) {
        return text + " " + UUID.randomUUID();
    }

    @Test
    void second_embed_is_served_from_the_cache() {
        String text = unique("Fences in residential districts may not exceed six feet.");
        long before = embeddingCache.size();

        float[] first = embeddingCache.embed(text, false);
        float[] second = embeddingCache.embed(text, false);

        assertThat(embeddingCache.size()).isEqualTo(before + 1);
        assertThat(second).containsExactly(first);
        assertThat(first).hasSize(embeddingProvider.dimension());
        assertThat(embeddingCache.lookup(ContentHasher.sha256(text), embeddingProvider.modelVersion()))
                .hasValueSatisfying(v -> assertThat(v).containsExactly(first));
    }

    @Test
    void query_and_document_framing_use_separate_entries() {
        String text = unique("parking in fire lanes");
        long before = embeddingCache.size();

        embeddingCache.embed(text, false);
        embeddingCache.embed(text, true);

        assertThat(embeddingCache.size()).isEqualTo(before + 2);
        assertThat(embeddingCache.lookup(
                ContentHasher.sha256(EmbeddingCache.QUERY_INSTRUCTION + text),
                embeddingProvider.modelVersion())).isPresent();
    }

    @Test
    void duplicate_texts_in_one_call_are_stored_once() {
        String text = unique("Signs may not be illuminated after 11 p.m.");
        long before = embeddingCache.size();

        List<float[]> vectors = embeddingCache.embedAll(List.of(text, text, text), false);

        assertThat(vectors).hasSize(3);
        assertThat(embeddingCache.size()).isEqualTo(before + 1);
    }

    @Test
    void insert_if_absent_tolerates_a_concurrent_writer() {
        String text = unique("Loading zones may be used between 6 a.m. and 10 a.m.");
        String hash = ContentHasher.sha256(text);
        float[] vector = new float[embeddingProvider.dimension()];
        String modelVersion = embeddingProvider.modelVersion();

        assertThat(embeddingCache.storeIfAbsent(hash, text, vector, modelVersion)).isTrue();
        assertThat(embeddingCache.storeIfAbsent(hash, text, vector, modelVersion)).isFalse();
        assertThat(cacheRepository.findByContentHashAndModelVersion(hash, modelVersion)).isPresent();
    }
}
