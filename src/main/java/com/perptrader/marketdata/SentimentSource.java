package com.perptrader.marketdata;

import com.perptrader.domain.model.SentimentSignal;
import java.util.Optional;

/** Optional enrichment: a sentiment score in [-1, 1] with a confidence in [0, 1]. */
public interface SentimentSource {

    Optional<SentimentSignal> fetchSentiment(String symbol);
}
