package com.marketbot.pipeline;

import com.marketbot.core.RunTelemetry;
import com.marketbot.model.Market;
import com.marketbot.model.PipelineStage;
import com.marketbot.model.ProcessingResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：BatchRunner（class）。
 * 主要职责：用固定大小线程池并发处理一批股票，逐个记录运行统计，并按输入顺序返回结果。
 */
public class BatchRunner {
    private static final Logger LOG = LogManager.getLogger(BatchRunner.class);

    private final PipelineOrchestrator orchestrator;
    private final int threads;
    private final int logEvery;

    public BatchRunner(PipelineOrchestrator orchestrator, int threads) {
        this(orchestrator, threads, 50);
    }

    public BatchRunner(PipelineOrchestrator orchestrator, int threads, int logEvery) {
        this.orchestrator = orchestrator;
        this.threads = Math.max(1, threads);
        this.logEvery = Math.max(0, logEvery);
    }

    public int threads() {
        return threads;
    }

    public List<ProcessingResult> runAll(List<String> tickers, Market market, RunTelemetry telemetry)
            throws InterruptedException {
        int total = tickers == null ? 0 : tickers.size();
        if (total == 0) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, total));
        CompletionService<IndexedResult> completion = new ExecutorCompletionService<>(pool);
        for (int i = 0; i < total; i++) {
            completion.submit(new TickerTask(i, tickers.get(i), market));
        }

        ProcessingResult[] results = new ProcessingResult[total];
        long startedNanos = System.nanoTime();
        try {
            for (int i = 0; i < total; i++) {
                Future<IndexedResult> future = completion.take();
                try {
                    IndexedResult indexed = future.get();
                    results[indexed.index] = indexed.result;
                    record(telemetry, indexed.result);
                } catch (ExecutionException e) {
                    // TickerTask never throws past the orchestrator; slot is filled below.
                    LOG.error("batch task crashed: {}", String.valueOf(e.getCause()));
                }
                int completed = i + 1;
                if (logEvery > 0 && (completed % logEvery == 0 || completed == total)) {
                    LOG.info("batch progress {}/{} market={} elapsed_ms={}",
                            completed, total, market, (System.nanoTime() - startedNanos) / 1_000_000L);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < total; i++) {
            if (results[i] == null) {
                results[i] = ProcessingResult.builder(tickers.get(i), market)
                        .failed(PipelineStage.EXCEPTION, "task did not complete");
                record(telemetry, results[i]);
            }
        }
        return new ArrayList<>(Arrays.asList(results));
    }

    private static void record(RunTelemetry telemetry, ProcessingResult result) {
        if (telemetry == null || result == null) {
            return;
        }
        long elapsedMs = result.elapsed.toMillis();
        if (result.skipped) {
            telemetry.recordTickerSkipped();
            telemetry.recordStep(RunTelemetry.STEP_PROCESS, elapsedMs, 1, 0, 0, "skipped " + result.ticker);
            return;
        }
        if (!result.success) {
            telemetry.recordTickerFailed(result.failedStageLabel());
            telemetry.recordStep(RunTelemetry.STEP_PROCESS, elapsedMs, 1, 0, 1,
                    result.ticker + " " + result.failedStageLabel());
            return;
        }
        telemetry.recordTickerOk();
        telemetry.recordStep(RunTelemetry.STEP_PROCESS, elapsedMs, 1, 1, 0, "");
        String sourceStep = ProcessingResult.SOURCE_EXISTING.equals(result.dataSource)
                ? RunTelemetry.STEP_EXISTING
                : RunTelemetry.STEP_DOWNLOAD;
        telemetry.recordStep(sourceStep, elapsedMs, 1, result.dataRows, 0, "");
        int indicatorFailures = result.indicatorTotalCount - result.indicatorSuccessCount;
        telemetry.recordStep(RunTelemetry.STEP_INDICATORS, 0L, result.indicatorTotalCount,
                result.indicatorSuccessCount, indicatorFailures, indicatorFailures > 0 ? result.ticker : "");
    }

    private static final class IndexedResult {
        private final int index;
        private final ProcessingResult result;

        private IndexedResult(int index, ProcessingResult result) {
            this.index = index;
            this.result = result;
        }
    }

    private final class TickerTask implements Callable<IndexedResult> {
        private final int index;
        private final String ticker;
        private final Market market;

        private TickerTask(int index, String ticker, Market market) {
            this.index = index;
            this.ticker = ticker;
            this.market = market;
        }

        @Override
        public IndexedResult call() {
            return new IndexedResult(index, orchestrator.process(ticker, market));
        }
    }
}
