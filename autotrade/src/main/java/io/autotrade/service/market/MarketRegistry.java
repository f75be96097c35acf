package io.autotrade.service.market;

import io.autotrade.domain.common.NotFoundException;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.market.MarketId;
import io.autotrade.domain.market.RegisteredMarket;
import io.autotrade.repository.MarketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Market Registry - canonicalizes (base, quote, exchange) triples into stable ids.
 *
 * Markets are permanent: retirement flips the {@code active} flag so that
 * history stays queryable. Resolved ids are cached; the cache is only an
 * accelerator, the repository stays the source of truth.
 */
public final class MarketRegistry {
    private static final Logger log = LoggerFactory.getLogger(MarketRegistry.class);

    private final MarketRepository marketRepo;
    private final Map<Market, MarketId> idCache = new ConcurrentHashMap<>();

    public MarketRegistry(MarketRepository marketRepo) {
        this.marketRepo = marketRepo;
    }

    /**
     * Resolve a triple to its id, registering it on first sight.
     * Casing and surrounding whitespace are normalized first.
     *
     * @throws io.autotrade.domain.common.InvalidSymbolException if any part is empty or malformed
     */
    public MarketId resolve(String base, String quote, String exchange) {
        return resolve(Market.of(base, quote, exchange));
    }

    public MarketId resolve(Market market) {
        MarketId cached = idCache.get(market);
        if (cached != null) {
            return cached;
        }
        RegisteredMarket record = marketRepo.findOrCreate(market);
        MarketId previous = idCache.putIfAbsent(market, record.id());
        if (previous == null) {
            log.info("Registered market {} as {}", market.key(), record.id());
        }
        return record.id();
    }

    /**
     * @throws NotFoundException if no market has this id
     */
    public Market lookup(MarketId id) {
        return lookupRecord(id).market();
    }

    public RegisteredMarket lookupRecord(MarketId id) {
        return marketRepo.findById(id)
            .orElseThrow(() -> new NotFoundException("Market", id.toString()));
    }

    /**
     * Mark a market as retired. Its data stays in place.
     */
    public void retire(MarketId id) {
        if (!marketRepo.setActive(id, false)) {
            throw new NotFoundException("Market", id.toString());
        }
        log.info("Retired market {}", id);
    }

    public void activate(MarketId id) {
        if (!marketRepo.setActive(id, true)) {
            throw new NotFoundException("Market", id.toString());
        }
        log.info("Re-activated market {}", id);
    }

    public boolean isActive(MarketId id) {
        return lookupRecord(id).active();
    }

    public List<RegisteredMarket> all() {
        return marketRepo.findAll();
    }

    public List<RegisteredMarket> activeMarkets() {
        return marketRepo.findAll().stream()
            .filter(RegisteredMarket::active)
            .toList();
    }

    /**
     * Register markets found in storage (e.g. from existing partition tables).
     */
    public int adopt(Collection<Market> markets) {
        int count = 0;
        for (Market market : markets) {
            resolve(market);
            count++;
        }
        if (count > 0) {
            log.info("Adopted {} markets from storage", count);
        }
        return count;
    }
}
