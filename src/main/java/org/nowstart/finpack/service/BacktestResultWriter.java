package org.nowstart.finpack.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.finpack.data.dto.BacktestResult;
import org.springframework.stereotype.Service;

/**
 * Exports a {@link BacktestResult} as pretty-printed JSON. Infinite ratios are written as the
 * strings {@code "Infinity"} and {@code "-Infinity"}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestResultWriter {

    private final ObjectMapper objectMapper;

    public Path write(BacktestResult result, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), result);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write backtest result to " + path, e);
        }
        log.info("event=backtest_result_written path={} success={}", path, result.success());
        return path;
    }
}
