package com.perptrader.backtest;

import com.perptrader.api.dto.request.BacktestRequest;
import com.perptrader.domain.model.Bar;
import com.perptrader.exception.BusinessException;
import com.perptrader.exception.ErrorCode;
import com.perptrader.exception.MarketDataException;
import com.perptrader.exception.ResourceNotFoundException;
import com.perptrader.marketdata.CsvBarLoader;
import com.perptrader.simulator.AccountDefaults;
import com.perptrader.simulator.EngineSettings;
import com.perptrader.strategy.StrategyFactory;
import com.perptrader.strategy.base.BaseStrategy;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs CSV-backed backtests on request. Each call gets a fresh strategy instance and a
 * fresh in-memory ledger; the persisted live ledger is never touched.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final StrategyFactory strategyFactory;
    private final BacktestReplayer backtestReplayer;
    private final CsvBarLoader csvBarLoader;
    private final EngineSettings engineSettings;
    private final AccountDefaults accountDefaults;
    private final Path dataDirectory;
    private final int defaultWarmupBars;
    private final int defaultBarWindow;

    public BacktestService(
            StrategyFactory strategyFactory,
            BacktestReplayer backtestReplayer,
            CsvBarLoader csvBarLoader,
            EngineSettings engineSettings,
            AccountDefaults accountDefaults,
            @Value("${perptrader.backtest.data-dir:./data}") String dataDirectory,
            @Value("${perptrader.backtest.warmup-bars:50}") int defaultWarmupBars,
            @Value("${perptrader.bot.bar-window:100}") int defaultBarWindow) {
        this.strategyFactory = strategyFactory;
        this.backtestReplayer = backtestReplayer;
        this.csvBarLoader = csvBarLoader;
        this.engineSettings = engineSettings;
        this.accountDefaults = accountDefaults;
        this.dataDirectory = Path.of(dataDirectory).toAbsolutePath().normalize();
        this.defaultWarmupBars = defaultWarmupBars;
        this.defaultBarWindow = defaultBarWindow;
    }

    public BacktestResult run(BacktestRequest request) {
        List<Bar> bars;
        NavigableMap<Instant, BigDecimal> fundingRates;
        try {
            bars = csvBarLoader.load(resolve(request.getCsvFile()));
            fundingRates = request.getFundingCsvFile() == null
                    ? new TreeMap<>()
                    : csvBarLoader.loadFundingRates(resolve(request.getFundingCsvFile()));
        } catch (MarketDataException e) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, e.getMessage());
        }
        if (bars.isEmpty()) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Bar file " + request.getCsvFile() + " has no rows");
        }

        String name = request.getStrategyName() != null
                ? request.getStrategyName()
                : request.getStrategyType() + "-" + request.getSymbol();
        BaseStrategy strategy = strategyFactory.create(request.getStrategyType(), name, request.getStrategyOptions());

        BacktestSettings.BacktestSettingsBuilder settings = BacktestSettings.builder()
                .symbol(request.getSymbol())
                .engineSettings(engineSettings)
                .accountDefaults(accountDefaults)
                .fundingRates(fundingRates)
                .startingEquity(request.getStartingEquity() != null
                        ? request.getStartingEquity()
                        : accountDefaults.getStartingEquity())
                .warmupBars(request.getWarmupBars() != null ? request.getWarmupBars() : defaultWarmupBars)
                .barWindow(request.getBarWindow() != null ? request.getBarWindow() : defaultBarWindow);
        if (request.getLeverage() != null) {
            settings.leverage(request.getLeverage());
        }
        if (request.getPositionSizePercent() != null) {
            settings.positionSizePercent(request.getPositionSizePercent());
        }

        log.info("Backtest requested: {} {} on {} ({} bars)", request.getStrategyType(), name, request.getCsvFile(), bars.size());
        return backtestReplayer.run(strategy, bars, settings.build());
    }

    /** Resolves a file name inside the data directory; anything escaping it is rejected. */
    Path resolve(String fileName) {
        Path path = dataDirectory.resolve(fileName).normalize();
        if (!path.startsWith(dataDirectory)) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "File must be inside the backtest data directory");
        }
        if (!Files.isRegularFile(path)) {
            throw new ResourceNotFoundException("Backtest data file", fileName);
        }
        return path;
    }
}
