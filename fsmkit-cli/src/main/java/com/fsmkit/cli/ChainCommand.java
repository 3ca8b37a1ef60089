package com.fsmkit.cli;

import com.fsmkit.FsmKitCLI;
import com.fsmkit.core.chain.FsmChainer;
import com.fsmkit.core.config.FsmKitConfig;
import com.fsmkit.core.generator.SpecGenerator;
import com.fsmkit.core.model.FsmSpec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to chain several specs into one, in the order given.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * fsmkit chain registration.yaml trader.yaml reset_pause.yaml --label TraderAbciApp
 * }</pre>
 */
@Command(
    name = "chain",
    description = "Chain FSM specs so each one's final states lead into the next one's start states",
    mixinStandardHelpOptions = true
)
public class ChainCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ChainCommand.class);

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private FsmKitCLI parent;

    @Parameters(arity = "1..*", description = "Spec files to chain, in execution order")
    private List<Path> specFiles;

    @Option(names = "--in-type", description = "Input format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private InputType inputType = InputType.AUTO;

    @Option(names = {"-l", "--label"}, description = "Label of the chained spec (default: from configuration)")
    private String label;

    @Option(names = "--output", description = "Output format id, see 'fsmkit list' (default: ${DEFAULT-VALUE})")
    private String output = "fsm-spec";

    @Override
    public Integer call() throws IOException {
        FsmKitConfig config = parent.getConfig();
        SpecGenerator generator = GeneratorLookup.byId(output, spec.commandLine());
        SpecLoader loader = new SpecLoader(config.parser());

        List<FsmSpec> fsms = new ArrayList<>();
        for (Path file : specFiles) {
            fsms.add(loader.load(file, inputType));
        }
        log.info("Chaining {} specs", fsms.size());

        String chainedLabel = label != null ? label : config.chain().label();
        FsmSpec chained = new FsmChainer(chainedLabel).chain(fsms);

        spec.commandLine().getOut().print(generator.generate(chained).content());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
