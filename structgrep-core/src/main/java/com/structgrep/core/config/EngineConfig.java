package com.structgrep.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.structgrep.core.match.MatchingOptions;

import java.time.Duration;
import java.util.List;

/**
 * Engine settings.
 *
 * <p>Loaded from {@code structgrep.yaml}. Every field is optional; missing values take the
 * defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * jobs: 4
 * timeoutSeconds: 5
 * maxTargetBytes: 1000000
 * matching:
 *   normalizeNumericLiterals: true
 * exclude:
 *   - "build/**"
 *   - "*Generated.java"
 * }</pre>
 *
 * @param jobs worker threads; values below 1 mean one per available processor
 * @param timeoutSeconds budget per (rule, file) pair; 0 or less disables the limit
 * @param maxTargetBytes files larger than this are skipped; 0 or less disables the limit
 * @param matching default equivalence options for rules that set none
 * @param exclude glob patterns of paths to skip when walking directories
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("jobs") Integer jobs,
    @JsonProperty("timeoutSeconds") Double timeoutSeconds,
    @JsonProperty("maxTargetBytes") Long maxTargetBytes,
    @JsonProperty("matching") MatchingOptions matching,
    @JsonProperty("exclude") List<String> exclude
) {
    public static final double DEFAULT_TIMEOUT_SECONDS = 5.0;
    public static final long DEFAULT_MAX_TARGET_BYTES = 1_000_000L;

    public EngineConfig {
        if (jobs == null || jobs < 1) {
            jobs = Math.max(1, Runtime.getRuntime().availableProcessors());
        }
        if (timeoutSeconds == null) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
        if (maxTargetBytes == null) {
            maxTargetBytes = DEFAULT_MAX_TARGET_BYTES;
        }
        if (matching == null) {
            matching = MatchingOptions.defaults();
        }
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, null);
    }

    /**
     * Per-pair time budget, or {@code null} when unlimited.
     */
    public Duration timeout() {
        return timeoutSeconds > 0 ? Duration.ofNanos(Math.max(1L, Math.round(timeoutSeconds * 1_000_000_000L))) : null;
    }

    public EngineConfig withJobs(int newJobs) {
        return new EngineConfig(newJobs, timeoutSeconds, maxTargetBytes, matching, exclude);
    }

    public EngineConfig withTimeoutSeconds(double newTimeoutSeconds) {
        return new EngineConfig(jobs, newTimeoutSeconds, maxTargetBytes, matching, exclude);
    }

    public EngineConfig withExclude(List<String> newExclude) {
        return new EngineConfig(jobs, timeoutSeconds, maxTargetBytes, matching, newExclude);
    }
}
