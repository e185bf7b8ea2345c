package com.marketbot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private String dataDir;
    private int threads;
    private List<String> inactiveTickers = new ArrayList<>();
    private Freshness freshness = new Freshness();

    @Getter
    @Setter
    public static class Freshness {
        private int openMaxAgeMinutes;
    }
}
