package com.fsmkit.core.generator;

import com.fsmkit.core.model.FsmSpec;

/**
 * Interface for generators that turn an {@link FsmSpec} into text.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI); the CLI selects
 * one by its {@link #getId() id} (e.g. {@code --output mermaid}).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.fsmkit.core.generator.SpecGenerator}
 *
 * @see GeneratedDiagram
 */
public interface SpecGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator on the command line. Lowercase
     * (e.g., "mermaid", "fsm-spec").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated output.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates text from the spec.
     *
     * @param spec the spec to render
     * @return generated content
     * @throws com.fsmkit.core.exception.FsmSpecException if the spec cannot be rendered
     */
    GeneratedDiagram generate(FsmSpec spec);
}
