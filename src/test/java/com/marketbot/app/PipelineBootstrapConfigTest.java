package com.marketbot.app;

import com.marketbot.config.Config;
import com.marketbot.model.Market;
import com.marketbot.pipeline.BatchRunner;
import com.marketbot.pipeline.PipelineOrchestrator;
import com.marketbot.pipeline.TickerAllowList;
import com.marketbot.storage.ArtifactLocator;
import com.marketbot.storage.ArtifactStore;
import com.marketbot.storage.FileArtifactLocator;
import com.marketbot.storage.RetentionSweeper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineBootstrapConfigTest {

    @TempDir
    Path dataDir;

    @Test
    void context_shouldWirePipelineFromProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put("pipeline.data-dir", dataDir.toString());
        props.put("pipeline.threads", 3);
        props.put("pipeline.inactive-tickers", "TWTR,ATVI");
        props.put("marketbot.outputs.dir", "build/marketbot-out");

        try (AnnotationConfigApplicationContext context = context(props)) {
            Config config = context.getBean(Config.class);
            assertEquals("build/marketbot-out", config.getString("outputs.dir"));
            assertEquals("override", config.sourceOf("outputs.dir"));

            if (System.getenv("MARKETBOT_DATA_DIR") == null) {
                assertEquals(dataDir, context.getBean(ArtifactStore.class).dataRoot());
                assertEquals(dataDir, ((FileArtifactLocator) context.getBean(ArtifactLocator.class)).dataRoot());
            }
            assertEquals(3, context.getBean(BatchRunner.class).threads());

            TickerAllowList allowList = context.getBean(TickerAllowList.class);
            assertFalse(allowList.isActive("twtr", Market.US));
            assertTrue(allowList.isActive("AAPL", Market.US));

            assertNotNull(context.getBean(PipelineOrchestrator.class));
            assertNotNull(context.getBean(RetentionSweeper.class));
        }
    }

    @Test
    void context_shouldFallBackToConfigDefaults() {
        try (AnnotationConfigApplicationContext context = context(Map.of())) {
            Config config = context.getBean(Config.class);
            assertEquals(config.getInt("batch.threads", 2), context.getBean(BatchRunner.class).threads());
            assertTrue(context.getBean(TickerAllowList.class).isActive("TWTR", Market.US));
        }
    }

    private static AnnotationConfigApplicationContext context(Map<String, Object> props) {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", props));
        context.register(PipelineBootstrapConfig.class);
        context.refresh();
        return context;
    }
}
