package com.fsmkit.cli;

import com.fsmkit.FsmKitCLI;
import com.fsmkit.core.config.FsmKitConfig;
import com.fsmkit.core.generator.GeneratedDiagram;
import com.fsmkit.core.generator.SpecGenerator;
import com.fsmkit.core.model.FsmSpec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to convert a spec file between Mermaid and YAML.
 *
 * <p>The label must end with the configured suffix ({@code AbciApp} by default); it
 * replaces whatever label the input carried.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * fsmkit convert fsm.mmd HelloWorldAbciApp --in-type mermaid --output fsm-spec
 * fsmkit convert fsm_specification.yaml HelloWorldAbciApp --output mermaid
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert an FSM spec between Mermaid and YAML",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private FsmKitCLI parent;

    @Parameters(index = "0", description = "Spec file to convert")
    private Path specFile;

    @Parameters(index = "1", description = "Label of the converted spec")
    private String label;

    @Option(names = "--in-type", description = "Input format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private InputType inputType = InputType.AUTO;

    @Option(names = "--output", description = "Output format id, see 'fsmkit list' (default: ${DEFAULT-VALUE})")
    private String output = "fsm-spec";

    @Override
    public Integer call() throws IOException {
        FsmKitConfig config = parent.getConfig();
        String suffix = config.cli().labelSuffix();
        if (!label.endsWith(suffix)) {
            throw new ParameterException(spec.commandLine(),
                "Label must end with '" + suffix + "': " + label);
        }
        SpecGenerator generator = GeneratorLookup.byId(output, spec.commandLine());

        log.info("Converting {} to {}", specFile, generator.getId());
        FsmSpec fsm = new SpecLoader(config.parser()).load(specFile, inputType).withLabel(label);
        GeneratedDiagram result = generator.generate(fsm);

        spec.commandLine().getOut().print(result.content());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
