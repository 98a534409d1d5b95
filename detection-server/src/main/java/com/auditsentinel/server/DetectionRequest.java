package com.auditsentinel.server;

import com.auditsentinel.core.config.RunConfig;
import com.auditsentinel.core.model.Record;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of {@code POST /detect}: the batch plus optional run options.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionRequest {

    private List<Record> records;

    /** Absent means {@link RunConfig#defaults()}. */
    private RunConfig runConfig;

    public List<Record> getRecords() {
        return records;
    }

    public void setRecords(List<Record> records) {
        this.records = records;
    }

    public RunConfig getRunConfig() {
        return runConfig != null ? runConfig : RunConfig.defaults();
    }

    public void setRunConfig(RunConfig runConfig) {
        this.runConfig = runConfig;
    }
}
