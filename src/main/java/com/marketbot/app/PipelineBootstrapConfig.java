package com.marketbot.app;

import com.marketbot.app.properties.PipelineProperties;
import com.marketbot.config.Config;
import com.marketbot.data.NaverChartClient;
import com.marketbot.data.ProviderResolver;
import com.marketbot.data.StooqClient;
import com.marketbot.data.YahooChartClient;
import com.marketbot.data.http.HttpClientEx;
import com.marketbot.indicator.IndicatorEngine;
import com.marketbot.pipeline.BatchRunner;
import com.marketbot.pipeline.PipelineOrchestrator;
import com.marketbot.pipeline.TickerAllowList;
import com.marketbot.quality.QualityGate;
import com.marketbot.session.FreshnessPolicy;
import com.marketbot.session.SessionClock;
import com.marketbot.storage.ArtifactLocator;
import com.marketbot.storage.ArtifactReader;
import com.marketbot.storage.ArtifactStore;
import com.marketbot.storage.FileArtifactLocator;
import com.marketbot.storage.RetentionSweeper;
import com.marketbot.transform.TimeframeDeriver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：PipelineBootstrapConfig（class）。
 * 主要职责：把 config.properties、"marketbot.*" 覆盖项与 "pipeline.*" 类型化属性组装成流水线对象图。
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineBootstrapConfig {
    public static final String OVERRIDE_PREFIX = "marketbot";

    @Bean
    public Config marketBotConfig(Environment environment) {
        Map<String, Object> overrides = Binder.get(environment)
                .bind(OVERRIDE_PREFIX, Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.load(workingDir).withOverrides(overrides);
    }

    @Bean
    public Clock marketBotClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionClock sessionClock(Clock clock) {
        return new SessionClock(clock);
    }

    @Bean
    public Path dataRoot(Config config, PipelineProperties properties) {
        String dataDir = firstNonBlank(
                System.getenv("MARKETBOT_DATA_DIR"),
                properties == null ? null : properties.getDataDir(),
                config.getString("data.dir")
        );
        return config.workingDir().resolve(dataDir).normalize();
    }

    @Bean
    public TimeframeDeriver timeframeDeriver() {
        return new TimeframeDeriver();
    }

    @Bean
    public ArtifactStore artifactStore(Path dataRoot, TimeframeDeriver deriver, Clock clock) {
        return new ArtifactStore(dataRoot, deriver, clock);
    }

    @Bean
    public ArtifactLocator artifactLocator(Path dataRoot) {
        return new FileArtifactLocator(dataRoot);
    }

    @Bean
    public ArtifactReader artifactReader(ArtifactLocator locator) {
        return new ArtifactReader(locator);
    }

    @Bean
    @Lazy
    public RetentionSweeper retentionSweeper(Path dataRoot, Clock clock) {
        return new RetentionSweeper(dataRoot, clock);
    }

    @Bean
    public HttpClientEx httpClient(Config config) {
        return new HttpClientEx(
                Math.max(1, config.getInt("yahoo.request_timeout_sec", 30)),
                config.getString("http.user_agent")
        );
    }

    @Bean
    public ProviderResolver providerResolver(Config config, HttpClientEx http) {
        return new ProviderResolver(
                new YahooChartClient(config, http),
                new NaverChartClient(config, http),
                new StooqClient(config, http)
        );
    }

    @Bean
    public FreshnessPolicy freshnessPolicy(
            ArtifactLocator locator,
            ArtifactReader reader,
            SessionClock sessionClock,
            Config config,
            PipelineProperties properties
    ) {
        int minutes = properties == null || properties.getFreshness() == null
                ? 0
                : properties.getFreshness().getOpenMaxAgeMinutes();
        if (minutes <= 0) {
            minutes = config.getInt("freshness.open_max_age_minutes", 60);
        }
        return new FreshnessPolicy(locator, reader, sessionClock, Duration.ofMinutes(Math.max(1, minutes)));
    }

    @Bean
    public TickerAllowList tickerAllowList(Config config, PipelineProperties properties) {
        List<String> inactive = new ArrayList<>(config.getList("tickers.inactive"));
        if (properties != null && properties.getInactiveTickers() != null) {
            inactive.addAll(properties.getInactiveTickers());
        }
        return TickerAllowList.excluding(inactive);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(
            FreshnessPolicy freshnessPolicy,
            ProviderResolver resolver,
            ArtifactStore store,
            ArtifactLocator locator,
            ArtifactReader reader,
            TimeframeDeriver deriver,
            SessionClock sessionClock,
            TickerAllowList allowList,
            Config config
    ) {
        return new PipelineOrchestrator(
                freshnessPolicy,
                resolver,
                new QualityGate(),
                store,
                locator,
                reader,
                deriver,
                new IndicatorEngine(),
                sessionClock,
                allowList,
                PipelineOrchestrator.Settings.fromConfig(config)
        );
    }

    @Bean
    public BatchRunner batchRunner(PipelineOrchestrator orchestrator, Config config, PipelineProperties properties) {
        int threads = properties == null ? 0 : properties.getThreads();
        if (threads <= 0) {
            threads = config.getInt("batch.threads", 2);
        }
        return new BatchRunner(orchestrator, threads, config.getInt("batch.progress_log_every", 50));
    }

    private static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
