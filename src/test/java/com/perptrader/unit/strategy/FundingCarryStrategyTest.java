package com.perptrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.perptrader.domain.enums.CloseReason;
import com.perptrader.domain.enums.DecisionType;
import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.PositionStatus;
import com.perptrader.domain.model.Bar;
import com.perptrader.domain.model.Position;
import com.perptrader.domain.model.SentimentSignal;
import com.perptrader.domain.model.Trade;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.MarketSnapshot;
import com.perptrader.strategy.impl.FundingCarryConfig;
import com.perptrader.strategy.impl.FundingCarryStrategy;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for FundingCarryStrategy. Also covers the guards inherited from BaseStrategy
 * (cooldown, confidence filter, sentiment veto, holding limit), since this family needs
 * only one bar.
 */
class FundingCarryStrategyTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Nested
    @DisplayName("Entry")
    class Entry {

        @Test
        @DisplayName("Positive funding opens a short with confidence scaled between min and target")
        void positiveRate_opensShort() {
            Decision decision = strategy(defaults()).evaluate(snapshot("0.03", "100", T0), Optional.empty());

            assertThat(decision.getType()).isEqualTo(DecisionType.OPEN);
            assertThat(decision.getSide()).isEqualTo(PositionSide.SHORT);
            assertThat(decision.getConfidence()).isCloseTo(6.5, within(1e-9));
            assertThat(decision.getReason()).contains("annualized");
        }

        @Test
        void negativeRate_opensLong() {
            Decision decision = strategy(defaults()).evaluate(snapshot("-0.02", "100", T0), Optional.empty());

            assertThat(decision.getSide()).isEqualTo(PositionSide.LONG);
        }

        @Test
        void rateAboveTarget_confidenceCappedAtTen() {
            Decision decision = strategy(defaults()).evaluate(snapshot("0.2", "100", T0), Optional.empty());

            assertThat(decision.getConfidence()).isEqualTo(10.0);
        }

        @Test
        void rateBelowMinimum_holds() {
            Decision decision = strategy(defaults()).evaluate(snapshot("0.005", "100", T0), Optional.empty());

            assertThat(decision.isHold()).isTrue();
        }

        @Test
        void missingRate_holds() {
            Decision decision = strategy(defaults()).evaluate(snapshot(null, "100", T0), Optional.empty());

            assertThat(decision.isHold()).isTrue();
            assertThat(decision.getReason()).isEqualTo("no funding rate");
        }
    }

    @Nested
    @DisplayName("Exit")
    class Exit {

        @Test
        void rateTurnedAgainstShort_closes() {
            Decision decision = strategy(defaults())
                    .evaluate(snapshot("-0.01", "100", T0.plusSeconds(3600)), Optional.of(shortAt("100", T0)));

            assertThat(decision.isClose()).isTrue();
            assertThat(decision.getReason()).contains("against");
        }

        @Test
        void rateDecayedBelowExitFraction_closes() {
            Decision decision = strategy(defaults())
                    .evaluate(snapshot("0.004", "100", T0.plusSeconds(3600)), Optional.of(shortAt("100", T0)));

            assertThat(decision.isClose()).isTrue();
            assertThat(decision.getReason()).contains("decayed");
        }

        @Test
        void rateBelowMinimum_closesOnlyAfterMinimumHolding() {
            FundingCarryStrategy strategy = strategy(defaults());
            Position position = shortAt("100", T0);

            Decision early = strategy.evaluate(snapshot("0.008", "100", T0.plus(Duration.ofHours(2))), Optional.of(position));
            Decision late = strategy.evaluate(snapshot("0.008", "100", T0.plus(Duration.ofHours(25))), Optional.of(position));

            assertThat(early.isHold()).isTrue();
            assertThat(late.isClose()).isTrue();
        }

        @Test
        void priceDeviation_closesEvenWhileFundingIsRich() {
            Decision decision = strategy(defaults())
                    .evaluate(snapshot("0.05", "115", T0.plusSeconds(3600)), Optional.of(shortAt("100", T0)));

            assertThat(decision.isClose()).isTrue();
            assertThat(decision.getReason()).contains("deviated");
        }

        @Test
        void richFunding_holdsPosition() {
            Decision decision = strategy(defaults())
                    .evaluate(snapshot("0.03", "101", T0.plusSeconds(3600)), Optional.of(shortAt("100", T0)));

            assertThat(decision.isHold()).isTrue();
        }
    }

    @Nested
    @DisplayName("Base strategy guards")
    class Guards {

        @Test
        @DisplayName("No re-entry on a symbol during the cooldown after a close")
        void cooldownAfterClose() {
            FundingCarryStrategy strategy = strategy(defaults());
            strategy.onPositionClosed(closedTrade(T0));

            Decision during = strategy.evaluate(snapshot("0.03", "100", T0.plusSeconds(60)), Optional.empty());
            Decision after = strategy.evaluate(snapshot("0.03", "100", T0.plusSeconds(121)), Optional.empty());

            assertThat(during.isHold()).isTrue();
            assertThat(during.getReason()).isEqualTo("cooldown");
            assertThat(after.isOpen()).isTrue();
        }

        @Test
        void confidenceBelowMinimum_becomesHold() {
            FundingCarryConfig config = FundingCarryConfig.builder().minConfidence(8.0).build();

            Decision decision = strategy(config).evaluate(snapshot("0.03", "100", T0), Optional.empty());

            assertThat(decision.isHold()).isTrue();
            assertThat(decision.getReason()).isEqualTo("confidence below minimum");
        }

        @Test
        void confidentOpposingSentiment_vetoesEntry() {
            FundingCarryConfig config = FundingCarryConfig.builder().sentimentVetoConfidence(0.6).build();
            MarketSnapshot snapshot = snapshot("0.03", "100", T0);
            snapshot.setSentiment(SentimentSignal.builder().score(0.8).confidence(0.7).source("test").build());

            Decision decision = strategy(config).evaluate(snapshot, Optional.empty());

            assertThat(decision.getReason()).isEqualTo("sentiment veto");
        }

        @Test
        void weakOrAgreeingSentiment_doesNotVeto() {
            FundingCarryConfig config = FundingCarryConfig.builder().sentimentVetoConfidence(0.6).build();
            MarketSnapshot agreeing = snapshot("0.03", "100", T0);
            agreeing.setSentiment(SentimentSignal.builder().score(-0.5).confidence(0.9).build());
            MarketSnapshot weak = snapshot("0.03", "100", T0);
            weak.setSentiment(SentimentSignal.builder().score(0.9).confidence(0.3).build());

            assertThat(strategy(config).evaluate(agreeing, Optional.empty()).isOpen()).isTrue();
            assertThat(strategy(config).evaluate(weak, Optional.empty()).isOpen()).isTrue();
        }

        @Test
        void holdingLimit_closesPosition() {
            FundingCarryConfig config = FundingCarryConfig.builder().maxHoldingSeconds(3600L).build();

            Decision decision = strategy(config)
                    .evaluate(snapshot("0.05", "100", T0.plusSeconds(3600)), Optional.of(shortAt("100", T0)));

            assertThat(decision.isClose()).isTrue();
            assertThat(decision.getReason()).contains("max holding time");
        }

        @Test
        void emptyHistory_holds() {
            MarketSnapshot snapshot = MarketSnapshot.builder()
                    .symbol("BTCUSDT")
                    .bars(List.of())
                    .fundingRate(new BigDecimal("0.05"))
                    .timestamp(T0)
                    .build();

            assertThat(strategy(defaults()).evaluate(snapshot, Optional.empty()).getReason())
                    .startsWith("insufficient history");
        }
    }

    private static FundingCarryConfig defaults() {
        return FundingCarryConfig.builder().build();
    }

    private static FundingCarryStrategy strategy(FundingCarryConfig config) {
        return new FundingCarryStrategy("STR-FC", "carry", config);
    }

    private static MarketSnapshot snapshot(String fundingRate, String close, Instant at) {
        BigDecimal price = new BigDecimal(close);
        Bar bar = Bar.builder()
                .timestamp(at)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(BigDecimal.ONE)
                .build();
        return MarketSnapshot.builder()
                .symbol("BTCUSDT")
                .bars(List.of(bar))
                .lastPrice(price)
                .timestamp(at)
                .fundingRate(fundingRate == null ? null : new BigDecimal(fundingRate))
                .build();
    }

    private static Position shortAt(String entry, Instant openedAt) {
        return Position.builder()
                .id("p1")
                .accountName("paper")
                .symbol("BTCUSDT")
                .side(PositionSide.SHORT)
                .size(BigDecimal.ONE)
                .entryPrice(new BigDecimal(entry))
                .leverage(2)
                .status(PositionStatus.OPEN)
                .openedAt(openedAt)
                .build();
    }

    private static Trade closedTrade(Instant closedAt) {
        return Trade.builder()
                .id("t1")
                .symbol("BTCUSDT")
                .side(PositionSide.SHORT)
                .netPnl(BigDecimal.ONE)
                .closeReason(CloseReason.STRATEGY_SIGNAL)
                .openedAt(closedAt.minusSeconds(600))
                .closedAt(closedAt)
                .build();
    }
}
