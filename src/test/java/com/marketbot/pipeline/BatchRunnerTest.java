package com.marketbot.pipeline;

import com.marketbot.core.RunTelemetry;
import com.marketbot.model.Market;
import com.marketbot.model.PipelineStage;
import com.marketbot.model.ProcessingResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchRunnerTest {

    @Test
    void runAll_shouldReturnResultsInInputOrder() throws Exception {
        List<String> tickers = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            tickers.add("T" + i);
        }
        BatchRunner runner = new BatchRunner(new ScriptedOrchestrator(), 4, 10);

        List<ProcessingResult> results = runner.runAll(tickers, Market.US, null);

        assertEquals(25, results.size());
        for (int i = 0; i < tickers.size(); i++) {
            assertEquals(tickers.get(i), results.get(i).ticker);
        }
    }

    @Test
    void runAll_shouldRecordOutcomesInTelemetry() throws Exception {
        RunTelemetry telemetry = new RunTelemetry("us-test", "cli", Instant.parse("2024-03-04T15:00:00Z"));
        BatchRunner runner = new BatchRunner(new ScriptedOrchestrator(), 2);

        List<ProcessingResult> results = runner.runAll(
                List.of("AAPL", "FAIL_DL", "SKIP", "MSFT", "FAIL_VAL"), Market.US, telemetry);

        assertEquals(5, results.size());
        assertEquals(2, telemetry.tickersOk());
        assertEquals(1, telemetry.tickersSkipped());
        assertEquals(2, telemetry.tickersFailed());
        assertEquals(Map.of("download", 1, "validation", 1), telemetry.failuresByStage());

        RunTelemetry.StepRecord process = telemetry.stepRecords().stream()
                .filter(r -> r.name().equals(RunTelemetry.STEP_PROCESS))
                .findFirst()
                .orElseThrow();
        assertEquals(5, process.itemsIn());
        assertEquals(2, process.itemsOut());
        assertEquals(2, process.errorCount());

        RunTelemetry.StepRecord download = telemetry.stepRecords().stream()
                .filter(r -> r.name().equals(RunTelemetry.STEP_DOWNLOAD))
                .findFirst()
                .orElseThrow();
        assertEquals(2, download.itemsIn());
        assertEquals(200, download.itemsOut());
    }

    @Test
    void runAll_shouldFillSlotWhenTaskCrashes() throws Exception {
        PipelineOrchestrator crashing = new ScriptedOrchestrator() {
            @Override
            public ProcessingResult process(String rawTicker, Market market) {
                if ("BOOM".equals(rawTicker)) {
                    throw new IllegalStateException("boom");
                }
                return super.process(rawTicker, market);
            }
        };
        RunTelemetry telemetry = new RunTelemetry("us-test", "cli", Instant.now());

        List<ProcessingResult> results = new BatchRunner(crashing, 2).runAll(List.of("AAPL", "BOOM"), Market.US, telemetry);

        assertTrue(results.get(0).success);
        assertFalse(results.get(1).success);
        assertEquals(PipelineStage.EXCEPTION, results.get(1).failedStage);
        assertEquals(1, telemetry.tickersFailed());
    }

    @Test
    void runAll_shouldReturnEmptyForNoTickers() throws Exception {
        assertTrue(new BatchRunner(new ScriptedOrchestrator(), 3).runAll(List.of(), Market.KOSPI, null).isEmpty());
    }

    private static class ScriptedOrchestrator extends PipelineOrchestrator {
        ScriptedOrchestrator() {
            super(null, null, null, null, null, null, null, null, null, null, null);
        }

        @Override
        public ProcessingResult process(String rawTicker, Market market) {
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ProcessingResult.Builder builder = ProcessingResult.builder(rawTicker, market);
            if (rawTicker.startsWith("FAIL_DL")) {
                return builder.failed(PipelineStage.DOWNLOAD, "no data");
            }
            if (rawTicker.startsWith("FAIL_VAL")) {
                return builder.failed(PipelineStage.VALIDATE, "too few rows");
            }
            if (rawTicker.equals("SKIP")) {
                return builder.skipped("inactive ticker");
            }
            return builder.dataSource(ProcessingResult.SOURCE_DOWNLOAD)
                    .dataRows(100)
                    .indicatorRows(100)
                    .indicatorCounts(3, 3)
                    .succeeded();
        }
    }
}
