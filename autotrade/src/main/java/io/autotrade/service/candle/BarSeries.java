package io.autotrade.service.candle;

import io.autotrade.domain.data.OhlcvBar;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, time-ordered, finite sequence of bars.
 *
 * Nothing is read until iteration starts. Each call to {@link #iterator()}
 * runs a fresh keyset-paged query, so a series can be re-iterated and will
 * reflect writes made in between. Results are not cached across iterations.
 */
public final class BarSeries implements Iterable<OhlcvBar> {

    /**
     * Fetch the next page of bars strictly after {@code afterExclusive}
     * (null for the first page).
     */
    @FunctionalInterface
    public interface PageFetcher {
        List<OhlcvBar> fetch(Instant afterExclusive, int limit);
    }

    private static final BarSeries EMPTY = new BarSeries((after, limit) -> List.of(), 1);

    private final PageFetcher fetcher;
    private final int pageSize;

    public BarSeries(PageFetcher fetcher, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.fetcher = fetcher;
        this.pageSize = pageSize;
    }

    public static BarSeries empty() {
        return EMPTY;
    }

    @Override
    public Iterator<OhlcvBar> iterator() {
        return new PagingIterator();
    }

    public Stream<OhlcvBar> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Materialize one full iteration.
     */
    public List<OhlcvBar> toList() {
        List<OhlcvBar> all = new ArrayList<>();
        forEach(all::add);
        return all;
    }

    private final class PagingIterator implements Iterator<OhlcvBar> {
        private List<OhlcvBar> page = List.of();
        private int position;
        private Instant lastSeen;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            page = fetcher.fetch(lastSeen, pageSize);
            position = 0;
            if (page.size() < pageSize) {
                exhausted = true;
            }
            return !page.isEmpty();
        }

        @Override
        public OhlcvBar next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            OhlcvBar bar = page.get(position++);
            lastSeen = bar.periodStart();
            return bar;
        }
    }
}
