package org.nowstart.finpack.service;

import org.nowstart.finpack.data.dto.BacktestProgress;

/**
 * Receives one call per simulated day after the equity snapshot is recorded.
 */
@FunctionalInterface
public interface BacktestProgressListener {

    void onProgress(BacktestProgress progress);
}
