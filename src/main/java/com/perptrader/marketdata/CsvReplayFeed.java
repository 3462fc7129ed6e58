package com.perptrader.marketdata;

import com.perptrader.domain.model.Bar;
import com.perptrader.exception.MarketDataException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default live feed: replays {@code <SYMBOL>.csv} files from a directory, one bar per poll.
 *
 * <p>Each symbol keeps a cursor. The first {@link #fetchBars} exposes {@code initialBars}
 * bars of history; every later call advances one bar. Once the file is exhausted the
 * cursor stays on the last bar. {@link #fetchPrice} returns the close at the cursor.
 *
 * <p>An optional {@code <SYMBOL>.funding.csv} ({@code timestamp,rate}, rate in percent per
 * interval) supplies the funding rate in force at the cursor's timestamp.
 */
public class CsvReplayFeed implements BarSource, PriceSource, FundingRateSource {

    private static final Logger log = LoggerFactory.getLogger(CsvReplayFeed.class);

    private final Path directory;
    private final int initialBars;
    private final CsvBarLoader loader;
    private final Map<String, Replay> replays = new ConcurrentHashMap<>();

    public CsvReplayFeed(Path directory, int initialBars, CsvBarLoader loader) {
        this.directory = directory;
        this.initialBars = Math.max(1, initialBars);
        this.loader = loader;
    }

    @Override
    public List<Bar> fetchBars(String symbol, int limit) {
        Replay replay = replayFor(symbol);
        synchronized (replay) {
            replay.advance();
            int from = Math.max(0, replay.cursor + 1 - limit);
            return List.copyOf(replay.bars.subList(from, replay.cursor + 1));
        }
    }

    @Override
    public BigDecimal fetchPrice(String symbol) {
        Replay replay = replayFor(symbol);
        synchronized (replay) {
            if (replay.cursor < 0) {
                replay.advance();
            }
            return replay.bars.get(replay.cursor).getClose();
        }
    }

    @Override
    public Optional<BigDecimal> fetchFundingRate(String symbol) {
        Replay replay = replayFor(symbol);
        synchronized (replay) {
            if (replay.fundingRates.isEmpty() || replay.cursor < 0) {
                return Optional.empty();
            }
            Instant now = replay.bars.get(replay.cursor).getTimestamp();
            Map.Entry<Instant, BigDecimal> entry = replay.fundingRates.floorEntry(now);
            return entry == null ? Optional.empty() : Optional.of(entry.getValue());
        }
    }

    private Replay replayFor(String symbol) {
        return replays.computeIfAbsent(symbol, this::openReplay);
    }

    private Replay openReplay(String symbol) {
        Path barFile = directory.resolve(symbol + ".csv");
        if (!Files.exists(barFile)) {
            throw new MarketDataException("No replay file for " + symbol + " at " + barFile);
        }
        List<Bar> bars = loader.load(barFile);
        if (bars.isEmpty()) {
            throw new MarketDataException("Replay file " + barFile + " has no bars");
        }
        NavigableMap<Instant, BigDecimal> fundingRates = loader.loadFundingRates(directory.resolve(symbol + ".funding.csv"));
        log.info("Replaying {}: {} bars, {} funding points", symbol, bars.size(), fundingRates.size());
        return new Replay(bars, fundingRates, Math.min(initialBars, bars.size()));
    }

    private static final class Replay {

        private final List<Bar> bars;
        private final NavigableMap<Instant, BigDecimal> fundingRates;
        private final int initialBars;
        private int cursor = -1;

        private Replay(List<Bar> bars, NavigableMap<Instant, BigDecimal> fundingRates, int initialBars) {
            this.bars = bars;
            this.fundingRates = fundingRates;
            this.initialBars = initialBars;
        }

        private void advance() {
            if (cursor < 0) {
                cursor = initialBars - 1;
            } else if (cursor < bars.size() - 1) {
                cursor++;
            }
        }
    }
}
