package com.fsmkit.cli;

import com.fsmkit.core.codec.FsmSpecCodec;
import com.fsmkit.core.exception.FormatException;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.parser.Dialect;
import com.fsmkit.core.parser.FsmParsers;
import com.fsmkit.core.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a spec file in any supported input format.
 */
class SpecLoader {

    private static final Logger log = LoggerFactory.getLogger(SpecLoader.class);

    private final ParserConfig parserConfig;
    private final FsmSpecCodec codec = new FsmSpecCodec();

    SpecLoader(ParserConfig parserConfig) {
        this.parserConfig = parserConfig;
    }

    /**
     * Loads a spec.
     *
     * @param file spec file
     * @param inputType declared format, {@link InputType#AUTO} to detect it
     * @return the spec
     * @throws IOException if the file cannot be read
     */
    FsmSpec load(Path file, InputType inputType) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        InputType effective = inputType == InputType.AUTO ? detect(text) : inputType;
        log.debug("Loading {} as {}", file, effective);
        return switch (effective) {
            case MERMAID -> FsmParsers.parse(text, parserConfig);
            case FSM_SPEC, AUTO -> codec.decode(text);
        };
    }

    private static InputType detect(String text) {
        try {
            Dialect.sniff(text);
            return InputType.MERMAID;
        } catch (FormatException e) {
            log.debug("No diagram keyword found ({}), reading as YAML spec", e.getMessage());
            return InputType.FSM_SPEC;
        }
    }
}
