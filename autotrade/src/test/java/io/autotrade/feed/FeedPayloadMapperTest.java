package io.autotrade.feed;

import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.common.InvalidSymbolException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;
import io.autotrade.repository.InMemoryMarketRepository;
import io.autotrade.service.candle.IngestResult;
import io.autotrade.service.market.MarketRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FeedPayloadMapperTest {

    private MarketRegistry registry;
    private FeedPayloadMapper mapper;

    @BeforeEach
    void setUp() {
        registry = new MarketRegistry(new InMemoryMarketRepository());
        mapper = new FeedPayloadMapper(registry);
    }

    @Test
    void testDecodeTickWithIsoTimestamp() {
        FeedPayloadMapper.FeedEvent event = mapper.decode(
            "{\"type\":\"tick\",\"exchange\":\"bitfinex\",\"base\":\"usd\",\"quote\":\"btc\","
                + "\"timestamp\":\"2016-12-01T00:00:30Z\",\"price\":770.12345678,\"volume\":\"0.25\"}");

        assertTrue(event.isTick());
        PriceTick tick = event.tick();
        assertEquals(Market.of("USD", "BTC", "Bitfinex"), tick.market());
        assertEquals(Instant.parse("2016-12-01T00:00:30Z"), tick.timestamp());
        assertEquals(0, new BigDecimal("770.12345678").compareTo(tick.price()), "Exact decimal, no double rounding");
        assertEquals(0, new BigDecimal("0.25").compareTo(tick.volume()));
        assertEquals(1, registry.all().size(), "Market registered on arrival");
    }

    @Test
    void testDecodeBarWithEpochTimestamp() {
        FeedPayloadMapper.FeedEvent event = mapper.decode(
            "{\"type\":\"bar\",\"exchange\":\"Bitfinex\",\"base\":\"USD\",\"quote\":\"BTC\",\"interval\":60,"
                + "\"timestamp\":1480550400,\"open\":\"770\",\"high\":\"775\",\"low\":\"768\",\"close\":\"772\",\"volume\":\"12.5\"}");

        assertFalse(event.isTick());
        OhlcvBar bar = event.bar();
        assertEquals(Interval.ONE_HOUR, bar.interval());
        assertEquals(Instant.parse("2016-12-01T00:00:00Z"), bar.periodStart());
        assertEquals(0, new BigDecimal("772").compareTo(bar.close()));
    }

    @Test
    void testMalformedPayloads() {
        assertThrows(InvalidBarException.class, () -> mapper.decode("{not json"));
        assertThrows(InvalidBarException.class, () -> mapper.decode("[1,2,3]"));
        assertThrows(InvalidBarException.class, () -> mapper.decode(
            "{\"type\":\"tick\",\"exchange\":\"Bitfinex\",\"base\":\"USD\",\"quote\":\"BTC\",\"timestamp\":1,\"price\":\"1\"}"),
            "missing volume");
        assertThrows(InvalidBarException.class, () -> mapper.decode(
            "{\"type\":\"trade\",\"exchange\":\"Bitfinex\",\"base\":\"USD\",\"quote\":\"BTC\",\"timestamp\":1}"));
        assertThrows(InvalidBarException.class, () -> mapper.decode(
            "{\"type\":\"tick\",\"exchange\":\"Bitfinex\",\"base\":\"USD\",\"quote\":\"BTC\",\"timestamp\":\"yesterday\","
                + "\"price\":\"1\",\"volume\":\"1\"}"));
        assertThrows(InvalidBarException.class, () -> mapper.decode(
            "{\"type\":\"bar\",\"exchange\":\"Bitfinex\",\"base\":\"USD\",\"quote\":\"BTC\",\"interval\":0,\"timestamp\":0,"
                + "\"open\":\"1\",\"high\":\"1\",\"low\":\"1\",\"close\":\"1\",\"volume\":\"1\"}"));
        assertTrue(registry.all().isEmpty(), "Rejected payloads must not register their market");
    }

    @Test
    void testMalformedSymbol() {
        assertThrows(InvalidSymbolException.class, () -> mapper.decode(
            "{\"type\":\"tick\",\"exchange\":\"Bitfinex\",\"base\":\"US_D\",\"quote\":\"BTC\",\"timestamp\":1,"
                + "\"price\":\"1\",\"volume\":\"1\"}"));
        assertTrue(registry.all().isEmpty());
    }

    @Test
    void testDispatchRoutesByType() {
        MarketFeedListener listener = mock(MarketFeedListener.class);
        when(listener.onTick(any())).thenReturn(CompletableFuture.completedFuture(null));
        when(listener.onBar(any())).thenReturn(CompletableFuture.completedFuture(IngestResult.INSERTED));

        mapper.dispatch("{\"type\":\"tick\",\"exchange\":\"Bitfinex\",\"base\":\"USD\",\"quote\":\"BTC\","
            + "\"timestamp\":1,\"price\":\"1\",\"volume\":\"1\"}", listener);

        verify(listener).onTick(any());
        verify(listener, never()).onBar(any());
    }
}
