package io.autotrade.domain.common;

/**
 * Raised when a market, account or session lookup finds nothing.
 */
public class NotFoundException extends PriceBaseException {

    private final String kind;
    private final String key;

    public NotFoundException(String kind, String key) {
        super(String.format("%s not found: %s", kind, key));
        this.kind = kind;
        this.key = key;
    }

    public String getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }
}
