package io.autotrade.domain.data;

import io.autotrade.domain.common.InvalidSymbolException;
import io.autotrade.domain.market.Market;

import java.util.Optional;

/**
 * One logical bar partition: (market, interval).
 *
 * Table naming: {@code PriceData_<exchange>_<base>_<quote>_<N>mins}; the raw
 * tick table of a market is {@code PriceData_<exchange>_<base>_<quote>_tick}.
 */
public record PartitionKey(Market market, Interval interval) {
    public static final String TABLE_PREFIX = "PriceData_";
    private static final String TICK_SUFFIX = "tick";

    public PartitionKey {
        if (market == null || interval == null) {
            throw new IllegalArgumentException("market and interval cannot be null");
        }
    }

    public static PartitionKey of(Market market, Interval interval) {
        return new PartitionKey(market, interval);
    }

    public String tableName() {
        return prefix(market) + interval.label();
    }

    public static String tickTableName(Market market) {
        return prefix(market) + TICK_SUFFIX;
    }

    private static String prefix(Market market) {
        return TABLE_PREFIX + market.exchange() + "_" + market.base() + "_" + market.quote() + "_";
    }

    /**
     * Parse a bar table name back into its partition key.
     * Returns empty for tick tables and for names that do not follow the convention.
     */
    public static Optional<PartitionKey> parse(String tableName) {
        String[] parts = split(tableName);
        if (parts == null || !parts[4].endsWith("mins")) {
            return Optional.empty();
        }
        try {
            int minutes = Integer.parseInt(parts[4].substring(0, parts[4].length() - 4));
            if (minutes <= 0) {
                return Optional.empty();
            }
            return Optional.of(new PartitionKey(Market.of(parts[2], parts[3], parts[1]), Interval.ofMinutes(minutes)));
        } catch (NumberFormatException | InvalidSymbolException e) {
            return Optional.empty();
        }
    }

    /**
     * Parse a tick table name back into its market.
     */
    public static Optional<Market> parseTickTable(String tableName) {
        String[] parts = split(tableName);
        if (parts == null || !TICK_SUFFIX.equals(parts[4])) {
            return Optional.empty();
        }
        try {
            return Optional.of(Market.of(parts[2], parts[3], parts[1]));
        } catch (InvalidSymbolException e) {
            return Optional.empty();
        }
    }

    private static String[] split(String tableName) {
        if (tableName == null || !tableName.startsWith(TABLE_PREFIX)) {
            return null;
        }
        String[] parts = tableName.split("_");
        return parts.length == 5 ? parts : null;
    }

    @Override
    public String toString() {
        return tableName();
    }
}
