package io.autotrade.repository;

import io.autotrade.domain.market.Market;
import io.autotrade.domain.market.MarketId;
import io.autotrade.domain.market.RegisteredMarket;

import java.util.List;
import java.util.Optional;

/**
 * Repository for canonical market records. There is no delete.
 */
public interface MarketRepository {

    /**
     * Return the record for the market, creating it if absent.
     * Concurrent calls with the same market return the same id.
     */
    RegisteredMarket findOrCreate(Market market);

    Optional<RegisteredMarket> findById(MarketId id);

    Optional<RegisteredMarket> findByMarket(Market market);

    /**
     * All markets ordered by id.
     */
    List<RegisteredMarket> findAll();

    /**
     * Flip the retirement flag.
     *
     * @return true if a market with this id exists
     */
    boolean setActive(MarketId id, boolean active);
}
