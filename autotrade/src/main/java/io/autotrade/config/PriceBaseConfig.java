package io.autotrade.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.PriceField;
import io.autotrade.infrastructure.retry.RetryPolicy;
import io.autotrade.service.candle.LateTickPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Runtime configuration of the price base.
 *
 * Loaded from JSON by {@link PriceBaseConfigLoader}; keys missing from the
 * file keep their {@link #defaults()} value. An empty {@code dbUrl} selects
 * in-memory storage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceBaseConfig(
    @JsonProperty("dbUrl")
    String dbUrl,                   // jdbc:postgresql://host:5432/db, empty = in-memory

    @JsonProperty("dbUser")
    String dbUser,

    @JsonProperty("dbPassword")
    String dbPassword,

    @JsonProperty("dbPoolSize")
    int dbPoolSize,

    @JsonProperty("intervalsMinutes")
    List<Integer> intervalsMinutes, // bar intervals built from ticks

    @JsonProperty("gracePeriodSeconds")
    long gracePeriodSeconds,        // how long a bucket stays open after its period ends

    @JsonProperty("lateTickPolicy")
    String lateTickPolicy,          // REJECT | DROP

    @JsonProperty("tickRetentionHours")
    long tickRetentionHours,

    @JsonProperty("retentionCheckMinutes")
    long retentionCheckMinutes,

    @JsonProperty("indicatorMinPeriods")
    int indicatorMinPeriods,

    @JsonProperty("indicatorWindow")
    int indicatorWindow,

    @JsonProperty("indicatorField")
    String indicatorField,          // OPEN | HIGH | LOW | CLOSE | VOLUME

    @JsonProperty("queueCapacity")
    int queueCapacity,

    @JsonProperty("ingestConsumers")
    int ingestConsumers,

    @JsonProperty("pageSize")
    int pageSize,                   // rows per range-query page

    @JsonProperty("retryInitialDelayMillis")
    long retryInitialDelayMillis,

    @JsonProperty("retryMaxDelayMillis")
    long retryMaxDelayMillis,

    @JsonProperty("retryMultiplier")
    double retryMultiplier,

    @JsonProperty("retryMaxAttempts")
    int retryMaxAttempts
) {
    public PriceBaseConfig {
        intervalsMinutes = intervalsMinutes == null ? List.of() : List.copyOf(intervalsMinutes);
    }

    public static PriceBaseConfig defaults() {
        return new PriceBaseConfig(
            "",
            "postgres",
            "",
            10,
            List.of(1, 5, 15, 60, 240, 1440),
            30,             // 30s grace for out-of-order ticks
            "DROP",
            168,            // keep raw ticks for 7 days
            60,
            5,              // need 5 periods with data for an average
            50,
            "CLOSE",
            10_000,
            2,
            500,
            200,
            10_000,
            2.0,
            5
        );
    }

    public PriceBaseConfig withDatabase(String url, String user, String password, int poolSize) {
        return new PriceBaseConfig(url, user, password, poolSize, intervalsMinutes, gracePeriodSeconds,
            lateTickPolicy, tickRetentionHours, retentionCheckMinutes, indicatorMinPeriods, indicatorWindow,
            indicatorField, queueCapacity, ingestConsumers, pageSize, retryInitialDelayMillis,
            retryMaxDelayMillis, retryMultiplier, retryMaxAttempts);
    }

    @JsonIgnore
    public boolean usesDatabase() {
        return dbUrl != null && !dbUrl.isBlank();
    }

    public List<Interval> intervals() {
        return intervalsMinutes.stream().map(Interval::ofMinutes).toList();
    }

    public Duration gracePeriod() {
        return Duration.ofSeconds(gracePeriodSeconds);
    }

    public LateTickPolicy latePolicy() {
        return LateTickPolicy.valueOf(lateTickPolicy);
    }

    public Duration tickRetention() {
        return Duration.ofHours(tickRetentionHours);
    }

    public Duration retentionCheckPeriod() {
        return Duration.ofMinutes(retentionCheckMinutes);
    }

    public PriceField priceField() {
        return PriceField.valueOf(indicatorField);
    }

    /**
     * Fresh retry policy; policies are stateful, so one per retried call.
     */
    public RetryPolicy retryPolicy() {
        return RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(retryInitialDelayMillis))
            .maxDelay(Duration.ofMillis(retryMaxDelayMillis))
            .multiplier(retryMultiplier)
            .maxAttempts(retryMaxAttempts)
            .build();
    }

    /**
     * Validate configuration values.
     */
    @JsonIgnore
    public boolean isValid() {
        return dbPoolSize > 0
            && !intervalsMinutes.isEmpty()
            && intervalsMinutes.stream().allMatch(m -> m != null && m > 0)
            && gracePeriodSeconds >= 0
            && isOneOf(lateTickPolicy, "REJECT", "DROP")
            && tickRetentionHours > 0
            && retentionCheckMinutes > 0
            && indicatorMinPeriods > 0
            && indicatorWindow > 0
            && isOneOf(indicatorField, "OPEN", "HIGH", "LOW", "CLOSE", "VOLUME")
            && queueCapacity > 0
            && ingestConsumers > 0
            && pageSize > 0
            && retryInitialDelayMillis > 0
            && retryMaxDelayMillis >= retryInitialDelayMillis
            && retryMultiplier > 1.0
            && retryMaxAttempts > 0;
    }

    private static boolean isOneOf(String value, String... allowed) {
        if (value == null) {
            return false;
        }
        for (String candidate : allowed) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }
}
