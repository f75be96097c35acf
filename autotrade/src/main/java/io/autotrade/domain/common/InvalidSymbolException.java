package io.autotrade.domain.common;

/**
 * Raised when a base, quote or exchange name is empty or malformed.
 */
public class InvalidSymbolException extends PriceBaseException {

    private final String field;
    private final String value;

    public InvalidSymbolException(String field, String value) {
        super(String.format("Invalid %s symbol: '%s'", field, value));
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
