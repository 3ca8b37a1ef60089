package com.fsmkit.cli;

import com.fsmkit.core.generator.SpecGenerator;
import com.fsmkit.core.parser.Dialect;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list available output formats and input dialects.
 *
 * <p>Output formats are discovered via Java Service Provider Interface (SPI).
 */
@Command(
    name = "list",
    description = "List available output formats and input dialects",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        out.println("Output formats:");
        List<SpecGenerator> generators = GeneratorLookup.all();
        if (generators.isEmpty()) {
            out.println("  No generators found.");
        }
        for (SpecGenerator generator : generators) {
            out.printf("  • %s (ID: %s, extension: .%s)%n",
                generator.getDisplayName(), generator.getId(), generator.getFileExtension());
        }

        out.println();
        out.println("Input dialects:");
        for (Dialect dialect : Dialect.values()) {
            out.printf("  • %s (keywords: %s)%n", dialect, String.join(", ", dialect.getKeywords()));
        }
        out.flush();
        return 0;
    }
}
