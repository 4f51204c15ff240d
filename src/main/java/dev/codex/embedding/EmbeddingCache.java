package dev.codex.embedding;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Content-addressed embedding cache keyed by {@code (sha256(text), model_version)}.
 *
 * <p>Queries are framed with the bge instruction prefix before hashing, so a query and a document
 * with the same wording occupy different entries. Misses in a call are de-duplicated and encoded in
 * one batched pass through the {@link BatchEncoder}. New vectors go through an insert-if-absent
 * statement; losing a race to a concurrent writer is not an error.
 */
@Service
public class EmbeddingCache {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

  /**
   * Query instruction recommended by the bge-small-en-v1.5 model documentation. Prepended to
   * search queries only, never to indexed documents.
   */
  public static final String QUERY_INSTRUCTION =
      "Represent this sentence for searching relevant passages: ";

  static final int PREVIEW_LENGTH = 200;

  private final EmbeddingCacheRepository repository;
  private final BatchEncoder batchEncoder;
  private final EmbeddingProvider provider;
  private final EmbeddingProperties properties;

  public EmbeddingCache(
      EmbeddingCacheRepository repository,
      BatchEncoder batchEncoder,
      EmbeddingProvider provider,
      EmbeddingProperties properties) {
    this.repository = repository;
    this.batchEncoder = batchEncoder;
    this.provider = provider;
    this.properties = properties;
  }

  /**
   * Returns the vector for a single text, embedding it on a miss.
   *
   * @param text the text to embed
   * @param isQuery whether to apply query framing
   * @return the cached or freshly computed vector
   */
  public float[] embed(String text, boolean isQuery) {
    return embedAll(List.of(text), isQuery).get(0);
  }

  /**
   * Returns one vector per text, embedding only the distinct texts not yet cached for the active
   * model version.
   *
   * @param texts texts to embed
   * @param isQuery whether to apply query framing
   * @return vectors in input order
   */
  public List<float[]> embedAll(List<String> texts, boolean isQuery) {
    if (texts.isEmpty()) {
      return List.of();
    }
    String modelVersion = provider.modelVersion();
    requireKnownModelVersion(modelVersion);

    List<String> hashes = new ArrayList<>(texts.size());
    Map<String, String> textByHash = new LinkedHashMap<>();
    for (String text : texts) {
      String framed = frame(text, isQuery);
      String hash = ContentHasher.sha256(framed);
      hashes.add(hash);
      textByHash.putIfAbsent(hash, framed);
    }

    Map<String, float[]> vectors = new HashMap<>();
    for (EmbeddingCacheEntry entry :
        repository.findByModelVersionAndContentHashIn(modelVersion, textByHash.keySet())) {
      batchEncoder.checkDimension(entry.getEmbedding());
      vectors.put(entry.getContentHash(), entry.getEmbedding());
    }

    List<String> missHashes =
        textByHash.keySet().stream().filter(hash -> !vectors.containsKey(hash)).toList();
    log.debug(
        "Embedding cache for {}: {} hits, {} misses over {} texts",
        modelVersion,
        vectors.size(),
        missHashes.size(),
        texts.size());

    if (!missHashes.isEmpty()) {
      List<float[]> encoded =
          batchEncoder.encode(missHashes.stream().map(textByHash::get).toList());
      for (int i = 0; i < missHashes.size(); i++) {
        String hash = missHashes.get(i);
        storeIfAbsent(hash, textByHash.get(hash), encoded.get(i), modelVersion);
        vectors.put(hash, encoded.get(i));
      }
    }

    return hashes.stream().map(vectors::get).toList();
  }

  /**
   * Looks up a cached vector without embedding anything.
   *
   * @param contentHash SHA-256 of the framed text
   * @param modelVersion the model version the vector was produced with
   * @return the cached vector, or empty on a miss
   * @throws UnknownModelVersionException if the model version is neither active nor legacy
   */
  public Optional<float[]> lookup(String contentHash, String modelVersion) {
    requireKnownModelVersion(modelVersion);
    return repository
        .findByContentHashAndModelVersion(contentHash, modelVersion)
        .map(EmbeddingCacheEntry::getEmbedding);
  }

  /** Number of cache entries recorded for the active model version. */
  public long size() {
    return repository.countByModelVersion(provider.modelVersion());
  }

  /**
   * Inserts a freshly computed vector unless another writer stored the same key first.
   *
   * @return true if this call inserted the row
   */
  boolean storeIfAbsent(String contentHash, String text, float[] vector, String modelVersion) {
    int inserted =
        repository.insertIfAbsent(
            contentHash, modelVersion, preview(text), toArrayLiteral(vector), vector.length);
    if (inserted == 0) {
      log.debug(
          "Cache entry {} for {} already stored by a concurrent writer", contentHash, modelVersion);
      return false;
    }
    return true;
  }

  static String frame(String text, boolean isQuery) {
    return isQuery ? QUERY_INSTRUCTION + text : text;
  }

  static String toArrayLiteral(float[] vector) {
    StringBuilder sb = new StringBuilder(vector.length * 12).append('{');
    for (int i = 0; i < vector.length; i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(vector[i]);
    }
    return sb.append('}').toString();
  }

  private static String preview(String text) {
    return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH);
  }

  private void requireKnownModelVersion(String modelVersion) {
    if (!properties.isKnownModelVersion(modelVersion)) {
      throw new UnknownModelVersionException(modelVersion);
    }
  }
}
