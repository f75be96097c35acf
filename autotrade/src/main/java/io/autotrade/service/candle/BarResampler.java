package io.autotrade.service.candle;

import io.autotrade.domain.common.ConflictException;
import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.market.Market;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Bar Resampler - merge bars of a finer interval into a coarser one.
 *
 * Pattern: for every coarse bucket, open = first fine bar's open, close =
 * last fine bar's close, high/low = max/min, volume = sum. Missing fine bars
 * are skipped; a coarse bucket with no fine bars yields no bar.
 */
public final class BarResampler {
    private static final Logger log = LoggerFactory.getLogger(BarResampler.class);

    /**
     * Counts from one backfill run.
     */
    public record BackfillReport(int inserted, int unchanged, int conflicts, int invalid) {
        public int total() {
            return inserted + unchanged + conflicts + invalid;
        }
    }

    private final PriceSeriesStore store;

    public BarResampler(PriceSeriesStore store) {
        this.store = store;
    }

    /**
     * Resample bars of one market and interval into {@code target} buckets.
     *
     * @throws IllegalArgumentException if target is not a multiple of the bars' interval
     *                                  or the bars mix markets or intervals
     */
    public static List<OhlcvBar> resample(List<OhlcvBar> bars, Interval target) {
        if (bars.isEmpty()) {
            return List.of();
        }
        OhlcvBar first = bars.get(0);
        Interval source = first.interval();
        if (!target.isMultipleOf(source)) {
            throw new IllegalArgumentException(target.label() + " is not a multiple of " + source.label());
        }

        Map<Instant, List<OhlcvBar>> byBucket = new TreeMap<>();
        for (OhlcvBar bar : bars) {
            if (!bar.market().equals(first.market()) || !bar.interval().equals(source)) {
                throw new IllegalArgumentException("Cannot resample mixed series: " + bar.partition() + " vs " + first.partition());
            }
            byBucket.computeIfAbsent(target.floor(bar.periodStart()), k -> new ArrayList<>()).add(bar);
        }

        List<OhlcvBar> result = new ArrayList<>(byBucket.size());
        for (Map.Entry<Instant, List<OhlcvBar>> entry : byBucket.entrySet()) {
            List<OhlcvBar> group = new ArrayList<>(entry.getValue());
            group.sort(Comparator.comparing(OhlcvBar::periodStart));

            BigDecimal high = group.stream().map(OhlcvBar::high).max(BigDecimal::compareTo).orElseThrow();
            BigDecimal low = group.stream().map(OhlcvBar::low).min(BigDecimal::compareTo).orElseThrow();
            BigDecimal volume = group.stream().map(OhlcvBar::volume).reduce(BigDecimal.ZERO, BigDecimal::add);

            result.add(new OhlcvBar(first.market(), target, entry.getKey(),
                group.get(0).open(), high, low, group.get(group.size() - 1).close(), volume));
        }
        return result;
    }

    /**
     * Build and store {@code target} bars from the {@code source} partition.
     *
     * Only coarse buckets that lie completely inside [from, to) are written,
     * so a bucket that is still forming is never frozen early. Existing
     * identical bars count as unchanged; conflicting ones are counted and
     * left untouched.
     */
    public BackfillReport backfill(Market market, Interval source, Interval target, Instant from, Instant to) {
        if (!target.isMultipleOf(source) || target.equals(source)) {
            throw new IllegalArgumentException(target.label() + " must be a coarser multiple of " + source.label());
        }

        Instant start = target.isAligned(from) ? from : target.floor(from).plusSeconds(target.seconds());
        Instant end = target.floor(to);
        if (!start.isBefore(end)) {
            log.info("Nothing to backfill for {} {} between {} and {}", market, target, from, to);
            return new BackfillReport(0, 0, 0, 0);
        }

        log.info("Backfilling {} {} from {} ({} to {})", market, target.label(), source.label(), start, end);

        List<OhlcvBar> fine = store.queryRange(market, source, start, end.minusSeconds(1)).toList();
        int inserted = 0;
        int unchanged = 0;
        int conflicts = 0;
        int invalid = 0;

        for (OhlcvBar bar : resample(fine, target)) {
            try {
                if (store.ingestBar(bar) == IngestResult.INSERTED) {
                    inserted++;
                } else {
                    unchanged++;
                }
            } catch (ConflictException e) {
                conflicts++;
            } catch (InvalidBarException e) {
                invalid++;
                log.warn("Skipped invalid resampled bar {} @ {}: {}", bar.partition(), bar.periodStart(), e.getMessage());
            }
        }

        BackfillReport report = new BackfillReport(inserted, unchanged, conflicts, invalid);
        log.info("Backfilled {} {}: {} inserted, {} unchanged, {} conflicts, {} invalid",
            market, target.label(), inserted, unchanged, conflicts, invalid);
        return report;
    }
}
