package com.gentoro.slotfill;

import com.gentoro.slotfill.cluster.ClusterParams;
import com.gentoro.slotfill.embedding.EmbeddingParams;
import com.gentoro.slotfill.exception.ConfigException;
import com.gentoro.slotfill.tagger.CrfParams;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Immutable settings of a {@link CrfSlotExtractor}.
 *
 * <p>Every hyperparameter has a default; {@link #from(Configuration)} reads overrides from the
 * {@code slots.*} namespace:
 *
 * <pre>
 * slots:
 *   workDir: /var/tmp/slots
 *   toolkit:
 *     provider: native
 *   clusters:
 *     count: 15
 *   crf:
 *     c1: 0.0001
 *     c2: 0.01
 *     maxIterations: 500
 *   embedding:
 *     dim: 15
 *     epoch: 50
 * </pre>
 */
public final class ExtractorConfig {
  public static final String NAMESPACE = "slots";
  public static final String DEFAULT_TOOLKIT = "native";

  private final EmbeddingParams embedding;
  private final ClusterParams clusters;
  private final CrfParams crf;
  private final Path workDir;
  private final String toolkitProvider;
  private final long progressMinIntervalMs;
  private final long progressMinDelta;

  private ExtractorConfig(Builder b) {
    this.embedding = Objects.requireNonNull(b.embedding, "embedding");
    this.clusters = Objects.requireNonNull(b.clusters, "clusters");
    this.crf = Objects.requireNonNull(b.crf, "crf");
    this.workDir = Objects.requireNonNull(b.workDir, "workDir");
    this.toolkitProvider = Objects.requireNonNull(b.toolkitProvider, "toolkitProvider");
    this.progressMinIntervalMs = b.progressMinIntervalMs;
    this.progressMinDelta = b.progressMinDelta;
  }

  public static ExtractorConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads {@code slots.*} keys, falling back to the defaults for every missing key. */
  public static ExtractorConfig from(Configuration root) {
    if (root == null) return defaults();
    Configuration cfg = root.subset(NAMESPACE);
    try {
      EmbeddingParams e = EmbeddingParams.DEFAULTS;
      ClusterParams c = ClusterParams.DEFAULTS;
      CrfParams r = CrfParams.DEFAULTS;
      Builder b =
          builder()
              .embedding(
                  new EmbeddingParams(
                      cfg.getString("embedding.method", e.method()),
                      cfg.getInt("embedding.minCount", e.minCount()),
                      cfg.getInt("embedding.bucket", e.bucket()),
                      cfg.getInt("embedding.dim", e.dim()),
                      cfg.getDouble("embedding.learningRate", e.learningRate()),
                      cfg.getInt("embedding.wordNgrams", e.wordNgrams()),
                      cfg.getInt("embedding.minn", e.minn()),
                      cfg.getInt("embedding.maxn", e.maxn()),
                      cfg.getInt("embedding.epoch", e.epoch())))
              .clusters(
                  new ClusterParams(
                      cfg.getInt("clusters.count", c.count()),
                      cfg.getInt("clusters.maxIterations", c.maxIterations()),
                      cfg.getLong("clusters.seed", c.seed())))
              .crf(
                  new CrfParams(
                      cfg.getString("crf.algorithm", r.algorithm()),
                      cfg.getDouble("crf.c1", r.c1()),
                      cfg.getDouble("crf.c2", r.c2()),
                      cfg.getInt("crf.maxIterations", r.maxIterations()),
                      cfg.getBoolean("crf.possibleTransitions", r.possibleTransitions()),
                      cfg.getBoolean("crf.possibleStates", r.possibleStates())))
              .toolkitProvider(cfg.getString("toolkit.provider", DEFAULT_TOOLKIT))
              .progressMinIntervalMs(cfg.getLong("progress.minIntervalMs", 1000L))
              .progressMinDelta(cfg.getLong("progress.minDelta", 50L));
      String workDir = cfg.getString("workDir", null);
      if (workDir != null && !workDir.isBlank()) {
        b.workDir(Path.of(workDir.trim()));
      }
      return b.build();
    } catch (ConversionException e) {
      throw new ConfigException("Invalid value under '" + NAMESPACE + "' configuration", e);
    }
  }

  public EmbeddingParams embedding() {
    return embedding;
  }

  public ClusterParams clusters() {
    return clusters;
  }

  public CrfParams crf() {
    return crf;
  }

  /** Base directory under which each extractor creates its scoped work directory. */
  public Path workDir() {
    return workDir;
  }

  public String toolkitProvider() {
    return toolkitProvider;
  }

  public long progressMinIntervalMs() {
    return progressMinIntervalMs;
  }

  public long progressMinDelta() {
    return progressMinDelta;
  }

  public Builder toBuilder() {
    return builder()
        .embedding(embedding)
        .clusters(clusters)
        .crf(crf)
        .workDir(workDir)
        .toolkitProvider(toolkitProvider)
        .progressMinIntervalMs(progressMinIntervalMs)
        .progressMinDelta(progressMinDelta);
  }

  @Override
  public String toString() {
    return "ExtractorConfig{"
        + "embedding="
        + embedding
        + ", clusters="
        + clusters
        + ", crf="
        + crf
        + ", workDir="
        + workDir
        + ", toolkitProvider='"
        + toolkitProvider
        + '\''
        + '}';
  }

  public static final class Builder {
    private EmbeddingParams embedding = EmbeddingParams.DEFAULTS;
    private ClusterParams clusters = ClusterParams.DEFAULTS;
    private CrfParams crf = CrfParams.DEFAULTS;
    private Path workDir = Path.of(System.getProperty("java.io.tmpdir"));
    private String toolkitProvider = DEFAULT_TOOLKIT;
    private long progressMinIntervalMs = 1000L;
    private long progressMinDelta = 50L;

    private Builder() {}

    public Builder embedding(EmbeddingParams embedding) {
      this.embedding = embedding;
      return this;
    }

    public Builder clusters(ClusterParams clusters) {
      this.clusters = clusters;
      return this;
    }

    public Builder crf(CrfParams crf) {
      this.crf = crf;
      return this;
    }

    public Builder workDir(Path workDir) {
      this.workDir = workDir;
      return this;
    }

    public Builder toolkitProvider(String toolkitProvider) {
      this.toolkitProvider =
          toolkitProvider == null ? null : toolkitProvider.trim().toLowerCase(Locale.ROOT);
      return this;
    }

    public Builder progressMinIntervalMs(long progressMinIntervalMs) {
      this.progressMinIntervalMs = progressMinIntervalMs;
      return this;
    }

    public Builder progressMinDelta(long progressMinDelta) {
      this.progressMinDelta = progressMinDelta;
      return this;
    }

    public ExtractorConfig build() {
      return new ExtractorConfig(this);
    }
  }
}
