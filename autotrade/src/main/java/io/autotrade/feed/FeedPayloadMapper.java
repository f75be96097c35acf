package io.autotrade.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;
import io.autotrade.service.market.MarketRegistry;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.CompletableFuture;

/**
 * Decodes crawler JSON payloads into ticks and bars.
 *
 * <pre>
 * {"type":"tick","exchange":"Bitfinex","base":"USD","quote":"BTC",
 *  "timestamp":"2016-12-01T00:00:30Z","price":"770.5","volume":"0.25"}
 * {"type":"bar","exchange":"Bitfinex","base":"USD","quote":"BTC","interval":60,
 *  "timestamp":1480550400,"open":"770","high":"775","low":"768","close":"772","volume":"12.5"}
 * </pre>
 *
 * Timestamps are ISO-8601 strings or epoch seconds; numbers may be JSON
 * numbers or strings and are read as exact decimals. Every market seen is
 * resolved through the registry once the payload has decoded, so new markets
 * are registered on arrival and malformed payloads register nothing.
 */
public final class FeedPayloadMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    /**
     * One decoded payload: exactly one of tick and bar is set.
     */
    public record FeedEvent(PriceTick tick, OhlcvBar bar) {
        public boolean isTick() {
            return tick != null;
        }
    }

    private final MarketRegistry registry;

    public FeedPayloadMapper(MarketRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws InvalidBarException if the payload is not valid JSON or misses a field
     * @throws io.autotrade.domain.common.InvalidSymbolException if the market triple is malformed
     */
    public FeedEvent decode(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidBarException("Malformed feed payload: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidBarException("Feed payload must be a JSON object");
        }

        String type = text(node, "type");
        Market market = Market.of(text(node, "base"), text(node, "quote"), text(node, "exchange"));
        Instant timestamp = timestamp(node);

        FeedEvent event = switch (type) {
            case "tick" -> new FeedEvent(
                new PriceTick(market, timestamp, decimal(node, "price"), decimal(node, "volume")), null);
            case "bar" -> new FeedEvent(null, new OhlcvBar(market, interval(node), timestamp,
                decimal(node, "open"), decimal(node, "high"), decimal(node, "low"),
                decimal(node, "close"), decimal(node, "volume")));
            default -> throw new InvalidBarException("Unknown payload type: " + type);
        };
        // only payloads that decode completely register their market
        registry.resolve(market);
        return event;
    }

    /**
     * Decode and hand the event to the listener.
     */
    public CompletableFuture<?> dispatch(String json, MarketFeedListener listener) {
        FeedEvent event = decode(json);
        return event.isTick() ? listener.onTick(event.tick()) : listener.onBar(event.bar());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw new InvalidBarException("Missing field '" + field + "' in feed payload");
        }
        return value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value != null && value.isNumber()) {
            return value.decimalValue();
        }
        String raw = text(node, field);
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidBarException("Field '" + field + "' is not a number: " + raw, e);
        }
    }

    private static Instant timestamp(JsonNode node) {
        JsonNode value = node.get("timestamp");
        if (value != null && value.isIntegralNumber()) {
            return Instant.ofEpochSecond(value.longValue());
        }
        String raw = text(node, "timestamp");
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new InvalidBarException("Field 'timestamp' is not ISO-8601 or epoch seconds: " + raw, e);
        }
    }

    private static Interval interval(JsonNode node) {
        JsonNode value = node.get("interval");
        if (value == null || !value.canConvertToInt() || value.intValue() <= 0) {
            throw new InvalidBarException("Bar payload needs a positive 'interval' in minutes");
        }
        return Interval.ofMinutes(value.intValue());
    }
}
