package com.deepansh.mq.batch;

import com.deepansh.mq.model.ModelConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Settings for one batch run.
 */
@Value
@Builder
public class BatchOptions {

    String modelShortname;
    ModelConfig model;

    int workers;

    /** Overrides the model's saved sysprompt when non-null. */
    String sysprompt;

    @Builder.Default
    String prefix = "";

    @Builder.Default
    String suffix = "";

    boolean extractTags;

    Duration timeout;
    Integer maxRetries;

    public String effectiveSysprompt() {
        return sysprompt != null ? sysprompt : model.getSysprompt();
    }
}
