package com.fsmkit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fsmkit.core.parser.ParserConfig;

/**
 * Root configuration for FsmKit.
 *
 * <p>Loaded from {@code fsmkit.yaml}. Every section is optional; missing sections and
 * values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   startStateFallback: MOST_FREQUENT
 *   defaultLabel: HelloWorldAbciApp
 *
 * chain:
 *   label: ChainedFSM
 *
 * cli:
 *   labelSuffix: AbciApp
 * }</pre>
 *
 * @param parser parser configuration
 * @param chain chaining configuration
 * @param cli command line configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FsmKitConfig(
    @JsonProperty("parser") ParserConfig parser,
    @JsonProperty("chain") ChainConfig chain,
    @JsonProperty("cli") CliConfig cli
) {
    /**
     * Compact constructor applying defaults for missing sections.
     */
    public FsmKitConfig {
        if (parser == null) {
            parser = ParserConfig.defaults();
        }
        if (chain == null) {
            chain = ChainConfig.defaults();
        }
        if (cli == null) {
            cli = CliConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static FsmKitConfig defaults() {
        return new FsmKitConfig(ParserConfig.defaults(), ChainConfig.defaults(), CliConfig.defaults());
    }

    /**
     * Chaining configuration.
     *
     * @param label label given to chained specs
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChainConfig(
        @JsonProperty("label") String label
    ) {
        public static final String DEFAULT_LABEL = "ChainedFSM";

        public ChainConfig {
            if (label == null || label.isBlank()) {
                label = DEFAULT_LABEL;
            }
        }

        public static ChainConfig defaults() {
            return new ChainConfig(DEFAULT_LABEL);
        }
    }

    /**
     * Command line configuration.
     *
     * @param labelSuffix suffix every label passed to {@code convert} must carry
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CliConfig(
        @JsonProperty("labelSuffix") String labelSuffix
    ) {
        public static final String DEFAULT_LABEL_SUFFIX = "AbciApp";

        public CliConfig {
            if (labelSuffix == null) {
                labelSuffix = DEFAULT_LABEL_SUFFIX;
            }
        }

        public static CliConfig defaults() {
            return new CliConfig(DEFAULT_LABEL_SUFFIX);
        }
    }
}
