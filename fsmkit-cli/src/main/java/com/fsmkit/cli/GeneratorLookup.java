package com.fsmkit.cli;

import com.fsmkit.core.generator.SpecGenerator;
import picocli.CommandLine;
import picocli.CommandLine.ParameterException;

import java.util.List;
import java.util.ServiceLoader;

/**
 * Finds registered {@link SpecGenerator}s via ServiceLoader.
 */
final class GeneratorLookup {

    private GeneratorLookup() {
        // Utility class
    }

    static List<SpecGenerator> all() {
        return ServiceLoader.load(SpecGenerator.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }

    static SpecGenerator byId(String id, CommandLine commandLine) {
        return all().stream()
            .filter(generator -> generator.getId().equalsIgnoreCase(id))
            .findFirst()
            .orElseThrow(() -> new ParameterException(commandLine,
                "Unknown output format: " + id + ". Use 'fsmkit list' to see available formats"));
    }
}
