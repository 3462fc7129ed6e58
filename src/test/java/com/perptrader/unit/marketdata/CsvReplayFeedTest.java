package com.perptrader.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.perptrader.domain.model.Bar;
import com.perptrader.exception.MarketDataException;
import com.perptrader.marketdata.CsvBarLoader;
import com.perptrader.marketdata.CsvReplayFeed;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvReplayFeedTest {

    @TempDir
    Path dataDir;

    private CsvReplayFeed feed;

    @BeforeEach
    void setUp() throws IOException {
        StringBuilder csv = new StringBuilder("timestamp,open,high,low,close,volume\n");
        for (int i = 0; i < 5; i++) {
            int close = 100 + i;
            csv.append(String.format("2024-01-01T00:0%d:00Z,%d,%d,%d,%d,10\n", i, close, close + 1, close - 1, close));
        }
        Files.writeString(dataDir.resolve("BTCUSDT.csv"), csv.toString());
        Files.writeString(
                dataDir.resolve("BTCUSDT.funding.csv"),
                "timestamp,rate\n2024-01-01T00:00:00Z,0.01\n2024-01-01T00:03:00Z,0.04\n");
        feed = new CsvReplayFeed(dataDir, 3, new CsvBarLoader());
    }

    @Test
    void firstPoll_exposesInitialHistory_thenOneBarPerPoll() {
        List<Bar> first = feed.fetchBars("BTCUSDT", 100);
        List<Bar> second = feed.fetchBars("BTCUSDT", 100);

        assertThat(first).hasSize(3);
        assertThat(second).hasSize(4);
        assertThat(feed.fetchPrice("BTCUSDT")).isEqualByComparingTo("103");
    }

    @Test
    void limitTrimsOldestBars() {
        feed.fetchBars("BTCUSDT", 2);
        List<Bar> bars = feed.fetchBars("BTCUSDT", 2);

        assertThat(bars).extracting(b -> b.getClose().intValue()).containsExactly(102, 103);
    }

    @Test
    void exhaustedFile_holdsLastBar() {
        for (int i = 0; i < 10; i++) {
            feed.fetchBars("BTCUSDT", 100);
        }

        assertThat(feed.fetchBars("BTCUSDT", 100)).hasSize(5);
        assertThat(feed.fetchPrice("BTCUSDT")).isEqualByComparingTo("104");
    }

    @Test
    void fundingRate_inForceAtCursor() {
        feed.fetchBars("BTCUSDT", 100);
        assertThat(feed.fetchFundingRate("BTCUSDT").orElseThrow()).isEqualByComparingTo("0.01");

        feed.fetchBars("BTCUSDT", 100);
        assertThat(feed.fetchFundingRate("BTCUSDT").orElseThrow()).isEqualByComparingTo("0.04");
    }

    @Test
    void unknownSymbol_failsAsMarketDataError() {
        assertThatThrownBy(() -> feed.fetchBars("DOGEUSDT", 10))
                .isInstanceOf(MarketDataException.class)
                .hasMessageContaining("DOGEUSDT");
    }
}
