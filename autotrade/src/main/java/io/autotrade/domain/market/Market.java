package io.autotrade.domain.market;

import io.autotrade.domain.common.InvalidSymbolException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical identity of a tradable pair on an exchange.
 *
 * Symbols are trimmed and upper-cased, the exchange name is trimmed and
 * capitalized ("bitFLYER" becomes "Bitflyer"), so two markets are equal iff
 * their normalized triples match. Underscores are rejected because they
 * separate the parts of a partition table name, and the length limits keep
 * every table name under the 63-character PostgreSQL identifier limit.
 */
public record Market(String base, String quote, String exchange) {
    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9]{1,10}");
    private static final Pattern EXCHANGE = Pattern.compile("[A-Za-z0-9]{1,16}");

    public Market {
        base = normalizeSymbol("base", base);
        quote = normalizeSymbol("quote", quote);
        exchange = normalizeExchange(exchange);
    }

    public static Market of(String base, String quote, String exchange) {
        return new Market(base, quote, exchange);
    }

    /**
     * Human-readable key, e.g. {@code Bitfinex:USD/BTC}.
     */
    public String key() {
        return exchange + ":" + base + "/" + quote;
    }

    @Override
    public String toString() {
        return key();
    }

    static String normalizeSymbol(String field, String raw) {
        if (raw == null) {
            throw new InvalidSymbolException(field, null);
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(value).matches()) {
            throw new InvalidSymbolException(field, raw);
        }
        return value;
    }

    static String normalizeExchange(String raw) {
        if (raw == null) {
            throw new InvalidSymbolException("exchange", null);
        }
        String value = raw.trim();
        if (!EXCHANGE.matcher(value).matches()) {
            throw new InvalidSymbolException("exchange", raw);
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
    }
}
