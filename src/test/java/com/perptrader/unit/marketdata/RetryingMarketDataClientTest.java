package com.perptrader.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.perptrader.exception.MarketDataException;
import com.perptrader.marketdata.BarSource;
import com.perptrader.marketdata.FundingRateSource;
import com.perptrader.marketdata.PriceSource;
import com.perptrader.marketdata.RetryingMarketDataClient;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetryingMarketDataClientTest {

    @Mock
    private BarSource barSource;

    @Mock
    private PriceSource priceSource;

    @Mock
    private FundingRateSource fundingRateSource;

    private RetryingMarketDataClient client;

    @BeforeEach
    void setUp() {
        client = new RetryingMarketDataClient(barSource, priceSource, fundingRateSource, null, 3, 1, 4);
    }

    @Test
    void transientFailure_retriedUntilSuccess() {
        when(priceSource.fetchPrice("BTCUSDT"))
                .thenThrow(new MarketDataException("429 rate limited"))
                .thenReturn(new BigDecimal("42000"));

        assertThat(client.fetchPrice("BTCUSDT")).contains(new BigDecimal("42000"));
        verify(priceSource, times(2)).fetchPrice("BTCUSDT");
    }

    @Test
    void exhaustedRetries_skipSymbol() {
        when(barSource.fetchBars("BTCUSDT", 100)).thenThrow(new MarketDataException("timeout"));

        assertThat(client.fetchBars("BTCUSDT", 100)).isEmpty();
        verify(barSource, times(3)).fetchBars("BTCUSDT", 100);
    }

    @Test
    void nonTransientFailure_notRetried() {
        when(priceSource.fetchPrice("BTCUSDT")).thenThrow(new IllegalStateException("bug"));

        assertThatThrownBy(() -> client.fetchPrice("BTCUSDT")).isInstanceOf(IllegalStateException.class);
        verify(priceSource, times(1)).fetchPrice("BTCUSDT");
    }

    @Test
    void absentFundingRate_isEmpty() {
        when(fundingRateSource.fetchFundingRate("BTCUSDT")).thenReturn(Optional.empty());

        assertThat(client.fetchFundingRate("BTCUSDT")).isEmpty();
    }

    @Test
    void missingSentimentSource_isEmpty() {
        assertThat(client.fetchSentiment("BTCUSDT")).isEmpty();
    }

    @Test
    void backoffDoublesUpToCap() {
        RetryingMarketDataClient defaults =
                new RetryingMarketDataClient(barSource, priceSource, null, null, 3, 200, 2000);

        assertThat(defaults.backoffMs(1)).isEqualTo(200);
        assertThat(defaults.backoffMs(2)).isEqualTo(400);
        assertThat(defaults.backoffMs(3)).isEqualTo(800);
        assertThat(defaults.backoffMs(6)).isEqualTo(2000);
    }
}
