package io.autotrade.feed;

import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.service.candle.IngestResult;

import java.util.concurrent.CompletableFuture;

/**
 * Push interface for crawlers and exchange feeds.
 *
 * Each call hands one event over and returns a future that completes once
 * the event is stored, or exceptionally with the error the store raised.
 */
public interface MarketFeedListener {

    CompletableFuture<Void> onTick(PriceTick tick);

    CompletableFuture<IngestResult> onBar(OhlcvBar bar);
}
