package com.marketbot.model;

public enum PipelineStage {
    PRECHECK("precheck"),
    STRATEGY("strategy"),
    USE_EXISTING("existing_process"),
    DOWNLOAD("download"),
    VALIDATE("validation"),
    SAVE_DAILY("daily_save"),
    DERIVE("derive"),
    INDICATORS("indicators"),
    DONE("done"),
    EXCEPTION("exception");

    public final String label;

    PipelineStage(String label) {
        this.label = label;
    }
}
