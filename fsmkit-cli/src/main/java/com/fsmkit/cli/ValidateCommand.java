package com.fsmkit.cli;

import com.fsmkit.FsmKitCLI;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.validation.FsmSpecValidator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a spec file against the model invariants.
 *
 * <p>Exits with 0 when the spec is consistent and 1 when violations were found.
 */
@Command(
    name = "validate",
    description = "Validate an FSM spec file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private FsmKitCLI parent;

    @Parameters(index = "0", description = "Spec file to validate")
    private Path specFile;

    @Option(names = "--in-type", description = "Input format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private InputType inputType = InputType.AUTO;

    @Override
    public Integer call() throws IOException {
        log.info("Validating FSM spec: {}", specFile);
        FsmSpec fsm = new SpecLoader(parent.getConfig().parser()).load(specFile, inputType);
        List<String> violations = new FsmSpecValidator().validate(fsm);

        PrintWriter out = spec.commandLine().getOut();
        if (violations.isEmpty()) {
            out.printf("%s: OK (%d states, %d transitions)%n",
                specFile, fsm.states().size(), fsm.transitionFunc().size());
            out.flush();
            return 0;
        }

        out.printf("%s: %d violation(s)%n", specFile, violations.size());
        for (String violation : violations) {
            out.printf("  - %s%n", violation);
        }
        out.flush();
        return 1;
    }
}
