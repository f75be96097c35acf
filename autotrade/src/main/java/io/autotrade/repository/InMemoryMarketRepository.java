package io.autotrade.repository;

import io.autotrade.domain.market.Market;
import io.autotrade.domain.market.MarketId;
import io.autotrade.domain.market.RegisteredMarket;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory MarketRepository, used when no database is configured.
 */
public final class InMemoryMarketRepository implements MarketRepository {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Market, RegisteredMarket> byMarket = new ConcurrentHashMap<>();
    private final Map<MarketId, Market> byId = new ConcurrentHashMap<>();

    public InMemoryMarketRepository(Clock clock) {
        this.clock = clock;
    }

    public InMemoryMarketRepository() {
        this(Clock.systemUTC());
    }

    @Override
    public RegisteredMarket findOrCreate(Market market) {
        return byMarket.computeIfAbsent(market, m -> {
            MarketId id = new MarketId(sequence.incrementAndGet());
            byId.put(id, m);
            return new RegisteredMarket(id, m, true, clock.instant());
        });
    }

    @Override
    public Optional<RegisteredMarket> findById(MarketId id) {
        Market market = byId.get(id);
        return market == null ? Optional.empty() : Optional.ofNullable(byMarket.get(market));
    }

    @Override
    public Optional<RegisteredMarket> findByMarket(Market market) {
        return Optional.ofNullable(byMarket.get(market));
    }

    @Override
    public List<RegisteredMarket> findAll() {
        List<RegisteredMarket> all = new ArrayList<>(byMarket.values());
        all.sort(Comparator.comparingLong(r -> r.id().value()));
        return all;
    }

    @Override
    public boolean setActive(MarketId id, boolean active) {
        Market market = byId.get(id);
        if (market == null) {
            return false;
        }
        byMarket.computeIfPresent(market, (m, record) -> record.withActive(active));
        return true;
    }
}
