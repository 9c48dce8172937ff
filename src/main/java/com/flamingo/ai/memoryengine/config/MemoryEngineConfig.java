package com.flamingo.ai.memoryengine.config;

import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the memory engine. */
@Configuration
@ConfigurationProperties(prefix = "memory")
@Validated
@Getter
@Setter
public class MemoryEngineConfig {

  /** Hard cap on graph expansion depth, whatever is configured. */
  public static final int MAX_GRAPH_DEPTH = 3;

  @Valid private Embedding embedding = new Embedding();
  @Valid private Ingest ingest = new Ingest();
  @Valid private Scoring scoring = new Scoring();
  @Valid private Dedup dedup = new Dedup();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Consolidation consolidation = new Consolidation();

  @Getter
  @Setter
  public static class Embedding {
    /** Store-wide embedding dimensionality. */
    @Min(1)
    private int dimensions = 1536;

    @Min(1)
    private long cacheMaxEntries = 10_000;

    @NotNull private Duration cacheTtl = Duration.ofHours(1);
  }

  @Getter
  @Setter
  public static class Ingest {
    @Min(1)
    private int maxContentLength = 16_000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultImportance = 0.5;

    /** New WORKING records since the last tick that request an early tick; 0 disables. */
    @Min(0)
    private int fillTriggerThreshold = 1000;
  }

  @Getter
  @Setter
  public static class Scoring {
    @Valid
    private TierPolicy working = new TierPolicy(1.0, Duration.ofMinutes(30), 0.8, 5);

    @Valid
    private TierPolicy shortTerm = new TierPolicy(30.0, Duration.ofDays(7), 0.9, 10);

    @Valid private TierPolicy longTerm = new TierPolicy(365.0, Duration.ZERO, 1.0, Long.MAX_VALUE);

    @DecimalMin("0.0")
    private double archivalFloor = 0.05;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double archivalImportanceCeiling = 0.3;

    /** Records accessed within this window are never archived by the background pass. */
    @NotNull private Duration recencyWindow = Duration.ofHours(1);

    @DecimalMin("0.0")
    private double accessReinforcement = 0.05;

    public TierPolicy policyFor(MemoryTier tier) {
      return switch (tier) {
        case WORKING -> working;
        case SHORT_TERM -> shortTerm;
        case LONG_TERM -> longTerm;
      };
    }
  }

  /** Decay and promotion rules of one tier. */
  @Getter
  @Setter
  public static class TierPolicy {
    @DecimalMin(value = "0.0", inclusive = false)
    private double halfLifeDays;

    @NotNull private Duration minDwell;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double promotionImportanceThreshold;

    @Min(0)
    private long promotionAccessThreshold;

    public TierPolicy() {}

    public TierPolicy(
        double halfLifeDays,
        Duration minDwell,
        double promotionImportanceThreshold,
        long promotionAccessThreshold) {
      this.halfLifeDays = halfLifeDays;
      this.minDwell = minDwell;
      this.promotionImportanceThreshold = promotionImportanceThreshold;
      this.promotionAccessThreshold = promotionAccessThreshold;
    }
  }

  @Getter
  @Setter
  public static class Dedup {
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.95;

    @Min(1)
    private int candidateLimit = 10;
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** K: maximum candidates per signal. */
    @Min(1)
    private int candidateLimit = 50;

    @Min(1)
    private int rrfK = 60;

    @Valid private Weights weights = new Weights();
    @Valid private Graph graph = new Graph();
    @NotNull private Duration signalTimeout = Duration.ofSeconds(5);

    @Min(1)
    private int defaultTokenBudget = 2000;

    @Min(1)
    private int charsPerToken = 4;

    @Valid private IntentWeighting intentWeighting = new IntentWeighting();

    /** Count an access on every record returned by a search. */
    private boolean touchOnRead = true;
  }

  @Getter
  @Setter
  public static class Weights {
    @DecimalMin("0.0")
    private double vector = 1.0;

    @DecimalMin("0.0")
    private double keyword = 1.0;

    @DecimalMin("0.0")
    private double graph = 1.0;

    public double weightOf(RetrievalSignal signal) {
      return switch (signal) {
        case VECTOR -> vector;
        case KEYWORD -> keyword;
        case GRAPH -> graph;
      };
    }
  }

  @Getter
  @Setter
  public static class Graph {
    private boolean enabled = true;

    @Min(1)
    private int maxDepth = MAX_GRAPH_DEPTH;

    /** Maximum entity nodes expanded per hop. */
    @Min(1)
    private int maxFrontier = 200;

    public int effectiveMaxDepth() {
      return Math.min(maxDepth, MAX_GRAPH_DEPTH);
    }
  }

  @Getter
  @Setter
  public static class IntentWeighting {
    private boolean enabled = true;

    /** Multiplier applied to the weight of the signal favoured by the query intent. */
    @DecimalMin("1.0")
    private double boost = 1.5;
  }

  @Getter
  @Setter
  public static class Consolidation {
    private boolean enabled = true;

    @NotNull private Duration interval = Duration.ofMinutes(10);

    @Min(1)
    private int batchSize = 500;

    @Min(1)
    private int maxParallelism = 5;

    /** Failures per record before it is dead-lettered. */
    @Min(1)
    private int retryBudget = 3;

    @Min(1)
    private int maxPagesPerTick = 20;

    /** Failed runs per job before it is dead-lettered. */
    @Min(1)
    private int jobRetryBudget = 3;

    @Valid private Summary summary = new Summary();
    @Valid private Grouping grouping = new Grouping();
  }

  @Getter
  @Setter
  public static class Summary {
    private boolean enabled = false;

    @Min(1)
    private int minContentLength = 500;
  }

  @Getter
  @Setter
  public static class Grouping {
    private boolean enabled = false;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.85;

    @Min(2)
    private int minGroupSize = 3;
  }
}
