package com.perptrader.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Precomputed sentiment reading for a symbol. {@code score} is in [-1, 1] (bearish to
 * bullish) and {@code confidence} in [0, 1]. Its provenance is irrelevant to the engine.
 */
@Value
@Builder
public class SentimentSignal {

    double score;
    double confidence;
    String source;
}
