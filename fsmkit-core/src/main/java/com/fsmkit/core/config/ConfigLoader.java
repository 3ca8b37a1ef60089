package com.fsmkit.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility for loading FsmKit configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code fsmkit.yaml} into {@link FsmKitConfig} records.
 * If the config file is missing or invalid, returns {@link FsmKitConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FsmKitConfig config = ConfigLoader.load(Paths.get("fsmkit.yaml"));
 * FsmSpec spec = FsmParsers.parse(text, config.parser());
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "fsmkit.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final List<String> SECTIONS = List.of("parser", "chain", "cli");

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>A missing file, or one that is unreadable or malformed, yields
     * {@link FsmKitConfig#defaults()}. Sections absent from a valid file take their
     * defaults individually and are named in the log.
     *
     * @param configPath path to {@code fsmkit.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static FsmKitConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No {} at {}, running with built-in settings", DEFAULT_CONFIG_FILE, configPath);
            return FsmKitConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Ignoring {}: not a readable file", configPath);
            return FsmKitConfig.defaults();
        }

        JsonNode tree;
        FsmKitConfig config;
        try {
            tree = YAML_MAPPER.readTree(configPath.toFile());
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                log.debug("{} is empty, running with built-in settings", configPath);
                return FsmKitConfig.defaults();
            }
            config = YAML_MAPPER.treeToValue(tree, FsmKitConfig.class);
        } catch (IOException e) {
            log.error("Ignoring {}: {}", configPath, e.getMessage());
            return FsmKitConfig.defaults();
        }

        List<String> defaulted = unconfiguredSections(tree);
        if (defaulted.isEmpty()) {
            log.info("Loaded configuration from {}", configPath);
        } else {
            log.info("Loaded configuration from {}, default settings for sections: {}", configPath, defaulted);
        }
        return config;
    }

    /**
     * Lists the top-level sections a configuration document leaves out.
     *
     * @param tree parsed configuration document
     * @return names of missing sections, in declaration order
     */
    static List<String> unconfiguredSections(JsonNode tree) {
        List<String> missing = new ArrayList<>();
        for (String section : SECTIONS) {
            JsonNode node = tree.get(section);
            if (node == null || node.isNull()) {
                missing.add(section);
            }
        }
        return missing;
    }
}
