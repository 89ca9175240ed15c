package tw.gc.quant.backtest.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.quant.backtest.exceptions.BacktestException;
import tw.gc.quant.backtest.exceptions.BacktestException.ErrorCode;

/**
 * Turns the bound {@code backtest.*} properties into the validated run parameters the engine
 * components are called with. A bad property fails application startup.
 */
@Configuration
@Slf4j
public class BacktestEngineConfig {

    @Bean
    public BacktestConfig backtestConfig(BacktestProperties properties) {
        try {
            BacktestConfig config = properties.toConfig();
            log.info("📊 Backtest defaults: capital={}, riskPerTrade={}, maxPositions={}, timeframe={}, compounding={}",
                    config.initialCapital(), config.riskPerTrade(), config.maxOpenPositions(),
                    config.timeframe(), config.compounding());
            return config;
        } catch (IllegalArgumentException e) {
            throw new BacktestException(ErrorCode.INVALID_CONFIGURATION, "Invalid backtest properties: " + e.getMessage(), e);
        }
    }

    @Bean
    public MonteCarloSettings monteCarloSettings(BacktestProperties properties) {
        try {
            return properties.getMonteCarlo().toSettings();
        } catch (IllegalArgumentException e) {
            throw new BacktestException(ErrorCode.INVALID_CONFIGURATION, "Invalid backtest.monte-carlo properties: " + e.getMessage(), e);
        }
    }

    @Bean
    public PortfolioSettings portfolioSettings(BacktestProperties properties) {
        try {
            return properties.toPortfolioSettings();
        } catch (IllegalArgumentException e) {
            throw new BacktestException(ErrorCode.INVALID_CONFIGURATION, "Invalid backtest.portfolio properties: " + e.getMessage(), e);
        }
    }
}
