package com.fsmkit.core.generator;

import java.util.Objects;

/**
 * Represents generated output for one spec.
 *
 * @param name name of the rendered spec (its label)
 * @param content generated text
 * @param fileExtension file extension for this content
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }
}
