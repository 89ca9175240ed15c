package tw.gc.quant.backtest.services.execution;

import org.springframework.stereotype.Service;
import tw.gc.quant.backtest.config.CostModelSettings;
import tw.gc.quant.backtest.entities.TradeCosts;

/**
 * Institutional execution cost model.
 *
 * <h3>Components:</h3>
 * <pre>
 * participation = min(quantity / averageVolume, 1)
 * slippage      = slippageCoefficient    * sqrt(participation) * 0.01
 * impact        = priceImpactCoefficient * sqrt(notional / 100000) * 0.0001
 * liquidity     = liquidityCoefficient   * (1 + 2 * participation) * 0.001
 * latency       = notional * volatility * sqrt(latencyMs / 1000) * 0.1
 * commission    = notional * tieredRate(notional)
 * </pre>
 *
 * <p>Commission tiers: full rate below 100k notional, 60% from 100k, 40% from 1M and 20%
 * from 10M. The model is a pure function of its arguments.
 */
@Service
public class CostModel {

    private static final double SLIPPAGE_SCALE = 0.01;
    private static final double IMPACT_SCALE = 0.0001;
    private static final double IMPACT_REFERENCE_NOTIONAL = 100_000;
    private static final double LIQUIDITY_SCALE = 0.001;
    private static final double LATENCY_SCALE = 0.1;

    private static final double TIER_1_NOTIONAL = 100_000;
    private static final double TIER_2_NOTIONAL = 1_000_000;
    private static final double TIER_3_NOTIONAL = 10_000_000;

    /**
     * Cost breakdown of filling {@code quantity} units at {@code price}.
     *
     * @param quantity units traded, positive
     * @param price fill price, positive
     * @param volatility annualized trailing volatility; zero when unavailable
     * @param averageVolume average traded volume per bar, positive
     * @param settings cost coefficients
     * @return the five non-negative cost components
     */
    public TradeCosts calculate(double quantity, double price, double volatility, double averageVolume,
                                CostModelSettings settings) {
        if (quantity <= 0 || price <= 0) {
            throw new IllegalArgumentException("quantity and price must be positive, got: %s @ %s"
                    .formatted(quantity, price));
        }
        double notional = quantity * price;
        double participation = Math.min(quantity / averageVolume, 1.0);

        double slippage = settings.slippageCoefficient() * Math.sqrt(participation) * SLIPPAGE_SCALE;
        double impact = settings.priceImpactCoefficient()
                * Math.sqrt(notional / IMPACT_REFERENCE_NOTIONAL) * IMPACT_SCALE;
        double liquidity = settings.liquidityCoefficient() * (1 + 2 * participation) * LIQUIDITY_SCALE;
        double latency = calculateLatencyCost(notional, volatility, settings.latencyMs());
        double commission = notional * commissionRate(notional, settings.commissionRate());

        return new TradeCosts(commission, slippage, impact, liquidity, latency);
    }

    double calculateLatencyCost(double notional, double volatility, long latencyMs) {
        if (volatility <= 0 || Double.isNaN(volatility)) {
            return 0.0;
        }
        double latencySeconds = latencyMs / 1000.0;
        return notional * volatility * Math.sqrt(latencySeconds) * LATENCY_SCALE;
    }

    /**
     * Volume-discounted commission rate for a trade of {@code notional}.
     */
    public double commissionRate(double notional, double baseRate) {
        if (notional >= TIER_3_NOTIONAL) {
            return baseRate * 0.2;
        }
        if (notional >= TIER_2_NOTIONAL) {
            return baseRate * 0.4;
        }
        if (notional >= TIER_1_NOTIONAL) {
            return baseRate * 0.6;
        }
        return baseRate;
    }
}
