package com.gotopipe.stacker.config;

import com.gotopipe.stacker.Const;
import com.gotopipe.stacker.reader.DateBound;
import com.gotopipe.stacker.store.ObservationSchema;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated stacking settings. Built once from the service configuration and handed to the
 * window reader, segmenter, batcher and orchestrator at construction.
 */
public final class StackingConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StackingConfig.class);

    public static final int DEFAULT_NSTACK = 4;
    public static final int DEFAULT_MAXSEQ = 12;
    public static final Duration DEFAULT_MAX_GAP = Duration.ofMinutes(30);

    private final List<String> independentColumns;
    private final int nstack;
    private final int maxseq;
    private final Duration maxGap;
    private final DateBound fromDate;
    private final DateBound toDate;
    private final int partitionParallelism;
    private final int runIntervalSeconds;
    private final String jdbcUrl;
    private final int jdbcPoolSize;

    public static class MalformedStackingConfigException extends Exception {
        public MalformedStackingConfigException(String message) {
            super(message);
        }

        public MalformedStackingConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private StackingConfig(Builder builder) {
        this.independentColumns = List.copyOf(builder.independentColumns);
        this.nstack = builder.nstack;
        this.maxseq = builder.maxseq;
        this.maxGap = builder.maxGap;
        this.fromDate = builder.fromDate;
        this.toDate = builder.toDate;
        this.partitionParallelism = builder.partitionParallelism;
        this.runIntervalSeconds = builder.runIntervalSeconds;
        this.jdbcUrl = builder.jdbcUrl;
        this.jdbcPoolSize = builder.jdbcPoolSize;
    }

    /**
     * Reads and validates the stacking settings.
     *
     * @throws MalformedStackingConfigException if a setting is missing or invalid
     */
    public static StackingConfig fromJson(JsonObject json) throws MalformedStackingConfigException {
        Builder builder = builder();
        try {
            JsonArray columns = json.getJsonArray(Const.Config.IndependentColumnsProp);
            if (columns == null) {
                LOGGER.error("stacking_config_error: {} is not set", Const.Config.IndependentColumnsProp);
                throw new MalformedStackingConfigException(Const.Config.IndependentColumnsProp + " is not set");
            }
            List<String> independentColumns = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                independentColumns.add(columns.getString(i));
            }
            builder.independentColumns(independentColumns)
                .nstack(json.getInteger(Const.Config.NStackProp, DEFAULT_NSTACK))
                .maxseq(json.getInteger(Const.Config.MaxSeqProp, DEFAULT_MAXSEQ))
                .maxGap(Duration.ofSeconds(json.getLong(Const.Config.MaxGapSecondsProp, DEFAULT_MAX_GAP.getSeconds())))
                .partitionParallelism(json.getInteger(Const.Config.PartitionParallelismProp, 1))
                .runIntervalSeconds(json.getInteger(Const.Config.RunIntervalSecondsProp, 0))
                .jdbcUrl(json.getString(Const.Config.JdbcUrlProp))
                .jdbcPoolSize(json.getInteger(Const.Config.JdbcPoolSizeProp, 4));

            String fromDate = json.getString(Const.Config.FromDateProp);
            if (fromDate != null && !fromDate.isBlank()) {
                builder.fromDate(DateBound.parse(fromDate));
            }
            String toDate = json.getString(Const.Config.ToDateProp);
            if (toDate != null && !toDate.isBlank()) {
                builder.toDate(DateBound.parse(toDate));
            }
        } catch (ClassCastException | IllegalArgumentException e) {
            LOGGER.error("stacking_config_error: failed to parse stacking config: {}", e.getMessage());
            throw new MalformedStackingConfigException("invalid stacking config: " + e.getMessage(), e);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .independentColumns(independentColumns)
            .nstack(nstack)
            .maxseq(maxseq)
            .maxGap(maxGap)
            .fromDate(fromDate)
            .toDate(toDate)
            .partitionParallelism(partitionParallelism)
            .runIntervalSeconds(runIntervalSeconds)
            .jdbcUrl(jdbcUrl)
            .jdbcPoolSize(jdbcPoolSize);
    }

    public List<String> getIndependentColumns() {
        return independentColumns;
    }

    /** Largest number of exposures combined into one stack. */
    public int getNstack() {
        return nstack;
    }

    /** Bursts longer than this are passed through instead of stacked. */
    public int getMaxseq() {
        return maxseq;
    }

    public Duration getMaxGap() {
        return maxGap;
    }

    /** Requested lower bound, or null for no bound. */
    public DateBound getFromDate() {
        return fromDate;
    }

    /** Requested upper bound, or null for no bound. */
    public DateBound getToDate() {
        return toDate;
    }

    public int getPartitionParallelism() {
        return partitionParallelism;
    }

    public int getRunIntervalSeconds() {
        return runIntervalSeconds;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public int getJdbcPoolSize() {
        return jdbcPoolSize;
    }

    @Override
    public String toString() {
        return "StackingConfig{independentColumns=" + independentColumns +
            ", nstack=" + nstack +
            ", maxseq=" + maxseq +
            ", maxGap=" + maxGap +
            ", fromDate=" + fromDate +
            ", toDate=" + toDate +
            ", partitionParallelism=" + partitionParallelism +
            ", runIntervalSeconds=" + runIntervalSeconds + "}";
    }

    public static class Builder {
        private List<String> independentColumns = ObservationSchema.DEFAULT_INDEPENDENT_COLUMNS;
        private int nstack = DEFAULT_NSTACK;
        private int maxseq = DEFAULT_MAXSEQ;
        private Duration maxGap = DEFAULT_MAX_GAP;
        private DateBound fromDate;
        private DateBound toDate;
        private int partitionParallelism = 1;
        private int runIntervalSeconds = 0;
        private String jdbcUrl;
        private int jdbcPoolSize = 4;

        public Builder independentColumns(List<String> independentColumns) {
            this.independentColumns = independentColumns;
            return this;
        }

        public Builder nstack(int nstack) {
            this.nstack = nstack;
            return this;
        }

        public Builder maxseq(int maxseq) {
            this.maxseq = maxseq;
            return this;
        }

        public Builder maxGap(Duration maxGap) {
            this.maxGap = maxGap;
            return this;
        }

        public Builder fromDate(DateBound fromDate) {
            this.fromDate = fromDate;
            return this;
        }

        public Builder toDate(DateBound toDate) {
            this.toDate = toDate;
            return this;
        }

        public Builder partitionParallelism(int partitionParallelism) {
            this.partitionParallelism = partitionParallelism;
            return this;
        }

        public Builder runIntervalSeconds(int runIntervalSeconds) {
            this.runIntervalSeconds = runIntervalSeconds;
            return this;
        }

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder jdbcPoolSize(int jdbcPoolSize) {
            this.jdbcPoolSize = jdbcPoolSize;
            return this;
        }

        public StackingConfig build() throws MalformedStackingConfigException {
            validate();
            return new StackingConfig(this);
        }

        private void validate() throws MalformedStackingConfigException {
            if (independentColumns == null || independentColumns.isEmpty()) {
                throw invalid("independent columns are empty");
            }
            Set<String> seen = new HashSet<>();
            for (String column : independentColumns) {
                if (column == null || !ObservationSchema.GROUPING_COLUMNS.contains(column)) {
                    throw invalid("unsupported independent column: " + column);
                }
                if (!seen.add(column)) {
                    throw invalid("duplicate independent column: " + column);
                }
            }
            if (nstack < 1) {
                throw invalid("nstack must be positive, got " + nstack);
            }
            if (maxseq < 1) {
                throw invalid("maxseq must be positive, got " + maxseq);
            }
            if (maxGap == null || maxGap.isNegative() || maxGap.isZero()) {
                throw invalid("max gap must be positive, got " + maxGap);
            }
            if (partitionParallelism < 1) {
                throw invalid("partition parallelism must be positive, got " + partitionParallelism);
            }
            if (runIntervalSeconds < 0) {
                throw invalid("run interval must not be negative, got " + runIntervalSeconds);
            }
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw invalid(Const.Config.JdbcUrlProp + " is not set");
            }
            if (jdbcPoolSize < 1) {
                throw invalid("jdbc pool size must be positive, got " + jdbcPoolSize);
            }
        }

        private static MalformedStackingConfigException invalid(String message) {
            LOGGER.error("stacking_config_error: {}", message);
            return new MalformedStackingConfigException("invalid stacking config: " + message);
        }
    }
}
