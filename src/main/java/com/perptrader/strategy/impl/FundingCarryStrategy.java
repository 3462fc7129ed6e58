package com.perptrader.strategy.impl;

import com.perptrader.domain.enums.PositionSide;
import com.perptrader.domain.enums.StrategyType;
import com.perptrader.domain.model.Position;
import com.perptrader.strategy.base.BaseStrategy;
import com.perptrader.strategy.base.Decision;
import com.perptrader.strategy.base.MarketSnapshot;
import java.math.BigDecimal;
import java.time.Duration;

/**
 * Funding-rate carry strategy. Positions on the side that receives funding while the
 * periodic rate is rich and steps aside when it fades.
 *
 * <p>A positive rate means longs pay shorts, so a rate at or above
 * {@code minFundingRatePercent} opens a SHORT; a sufficiently negative rate opens a LONG.
 * Confidence scales from 3 at the minimum to 10 at {@code targetFundingRatePercent}.
 *
 * <p>Exits, measured on the rate as seen from the position (positive = still receiving):
 * <ul>
 *   <li>the rate turned against the position</li>
 *   <li>the rate decayed below {@code exitFraction * minFundingRatePercent}</li>
 *   <li>after {@code minHoldingHours}, the rate is below the minimum</li>
 *   <li>price moved more than {@code maxPriceDeviationPercent} from entry</li>
 * </ul>
 */
public class FundingCarryStrategy extends BaseStrategy {

    private final FundingCarryConfig carryConfig;

    public FundingCarryStrategy(String id, String name, FundingCarryConfig config) {
        super(id, name, config);
        this.carryConfig = config;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.FUNDING_CARRY;
    }

    @Override
    public int getMinimumBarsRequired() {
        return 1;
    }

    @Override
    protected Decision evaluateEntry(MarketSnapshot snapshot) {
        BigDecimal fundingRate = snapshot.getFundingRate();
        if (fundingRate == null) {
            return Decision.hold("no funding rate");
        }
        double rate = fundingRate.doubleValue();
        double magnitude = Math.abs(rate);
        if (magnitude < carryConfig.getMinFundingRatePercent()) {
            return Decision.hold();
        }

        PositionSide side = rate > 0 ? PositionSide.SHORT : PositionSide.LONG;
        double span = carryConfig.getTargetFundingRatePercent() - carryConfig.getMinFundingRatePercent();
        double confidence = Math.min(10.0, 3.0 + 7.0 * (magnitude - carryConfig.getMinFundingRatePercent()) / span);
        String reason = String.format(
                "funding %.4f%% per %dh (%.1f%% annualized)", rate, carryConfig.getFundingIntervalHours(),
                annualizedPercent(magnitude));
        return Decision.open(side, confidence, null, null, null, reason);
    }

    @Override
    protected Decision evaluateExit(MarketSnapshot snapshot, Position position) {
        BigDecimal price = snapshot.lastBar().getClose();
        double deviation = Math.abs(movePercent(position, price));
        if (deviation > carryConfig.getMaxPriceDeviationPercent()) {
            return Decision.close(String.format("price deviated %.2f%% from entry", deviation));
        }

        BigDecimal fundingRate = snapshot.getFundingRate();
        if (fundingRate == null) {
            return Decision.hold("no funding rate");
        }
        double received = position.getSide() == PositionSide.SHORT ? fundingRate.doubleValue() : -fundingRate.doubleValue();
        double minimum = carryConfig.getMinFundingRatePercent();

        if (received < 0) {
            return Decision.close("funding turned against position");
        }
        if (received < minimum * carryConfig.getExitFraction()) {
            return Decision.close(String.format("funding decayed to %.4f%%", received));
        }
        long heldHours = Duration.between(position.getOpenedAt(), snapshot.getTimestamp()).toHours();
        if (heldHours >= carryConfig.getMinHoldingHours() && received < minimum) {
            return Decision.close(String.format("funding %.4f%% below minimum after %dh", received, heldHours));
        }
        return Decision.hold();
    }

    /** Simple annualization: rate per interval times the number of intervals in a year. */
    double annualizedPercent(double ratePerInterval) {
        return ratePerInterval * (365.0 * 24.0 / carryConfig.getFundingIntervalHours());
    }
}
