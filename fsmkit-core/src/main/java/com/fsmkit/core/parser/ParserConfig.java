package com.fsmkit.core.parser;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration for the dialect parsers.
 *
 * @param startStateFallback behaviour when no start-state candidate exists
 * @param defaultLabel placeholder label given to parsed specs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserConfig(
    @JsonProperty("startStateFallback") StartStateFallback startStateFallback,
    @JsonProperty("defaultLabel") String defaultLabel
) {
    public static final String DEFAULT_LABEL = "HelloWorldAbciApp";

    /**
     * Compact constructor applying defaults for missing values.
     */
    public ParserConfig {
        if (startStateFallback == null) {
            startStateFallback = StartStateFallback.MOST_FREQUENT;
        }
        if (defaultLabel == null || defaultLabel.isBlank()) {
            defaultLabel = DEFAULT_LABEL;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default parser config
     */
    public static ParserConfig defaults() {
        return new ParserConfig(StartStateFallback.MOST_FREQUENT, DEFAULT_LABEL);
    }
}
