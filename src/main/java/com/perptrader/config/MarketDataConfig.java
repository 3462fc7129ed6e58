package com.perptrader.config;

import com.perptrader.marketdata.CsvBarLoader;
import com.perptrader.marketdata.CsvReplayFeed;
import com.perptrader.marketdata.RetryingMarketDataClient;
import com.perptrader.marketdata.SentimentSource;
import java.nio.file.Path;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Market-data wiring. The bundled feed replays CSV files one bar per tick; it serves bars,
 * prices and funding rates. No sentiment source ships, so sentiment is absent unless a
 * {@link SentimentSource} bean is registered.
 *
 * <p>Properties prefix: {@code perptrader.market-data.*}
 */
@Configuration
public class MarketDataConfig {

    @Bean
    public CsvBarLoader csvBarLoader() {
        return new CsvBarLoader();
    }

    @Bean
    public CsvReplayFeed csvReplayFeed(
            @Value("${perptrader.market-data.replay.dir:./data}") String directory,
            @Value("${perptrader.market-data.replay.initial-bars:100}") int initialBars,
            CsvBarLoader csvBarLoader) {
        return new CsvReplayFeed(Path.of(directory), initialBars, csvBarLoader);
    }

    @Bean
    public RetryingMarketDataClient retryingMarketDataClient(
            CsvReplayFeed feed,
            ObjectProvider<SentimentSource> sentimentSource,
            @Value("${perptrader.market-data.retry.max-attempts:3}") int maxAttempts,
            @Value("${perptrader.market-data.retry.base-delay-ms:200}") long baseDelayMs,
            @Value("${perptrader.market-data.retry.max-delay-ms:2000}") long maxDelayMs) {
        return new RetryingMarketDataClient(
                feed, feed, feed, sentimentSource.getIfAvailable(), maxAttempts, baseDelayMs, maxDelayMs);
    }
}
