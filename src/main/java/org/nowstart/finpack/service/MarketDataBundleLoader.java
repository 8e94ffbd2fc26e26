package org.nowstart.finpack.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.finpack.data.dto.MarketDataBundle;
import org.nowstart.finpack.data.exception.BacktestException;
import org.springframework.stereotype.Service;

/**
 * Reads a {@link MarketDataBundle} from its JSON form. Dates are ISO-8601 strings, both as
 * values and as map keys; country keys are {@code US} or {@code TW}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataBundleLoader {

    private final ObjectMapper objectMapper;

    public MarketDataBundle load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new BacktestException(BacktestException.INVALID_BUNDLE, "Market data file not found: " + path);
        }
        try (InputStream input = Files.newInputStream(path)) {
            MarketDataBundle bundle = read(input);
            log.info("event=market_data_loaded path={} dates={} tickers={}", path, bundle.dates().size(), bundle.stockInfo().size());
            return bundle;
        } catch (IOException e) {
            throw new BacktestException(BacktestException.INVALID_BUNDLE, "Cannot read market data file " + path + ": " + e.getMessage(), e);
        }
    }

    public MarketDataBundle read(InputStream input) {
        MarketDataBundle bundle;
        try {
            bundle = objectMapper.readValue(input, MarketDataBundle.class);
        } catch (IOException e) {
            throw new BacktestException(BacktestException.INVALID_BUNDLE, "Malformed market data: " + e.getMessage(), e);
        }
        if (bundle == null || bundle.dates() == null || bundle.prices() == null || bundle.stockInfo() == null) {
            throw new BacktestException(BacktestException.INVALID_BUNDLE, "Market data requires dates, prices and stockInfo");
        }
        return bundle;
    }
}
