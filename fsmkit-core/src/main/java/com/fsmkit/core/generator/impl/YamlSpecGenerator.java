package com.fsmkit.core.generator.impl;

import com.fsmkit.core.codec.FsmSpecCodec;
import com.fsmkit.core.generator.GeneratedDiagram;
import com.fsmkit.core.generator.SpecGenerator;
import com.fsmkit.core.model.FsmSpec;

import java.util.Objects;

/**
 * Writes an {@link FsmSpec} as its YAML specification document.
 *
 * <p>Thin adapter over {@link FsmSpecCodec#encode(FsmSpec)} so the YAML form can be
 * selected like any other output format.
 */
public class YamlSpecGenerator implements SpecGenerator {

    private final FsmSpecCodec codec = new FsmSpecCodec();

    @Override
    public String getId() {
        return "fsm-spec";
    }

    @Override
    public String getDisplayName() {
        return "FSM Specification (YAML)";
    }

    @Override
    public String getFileExtension() {
        return "yaml";
    }

    @Override
    public GeneratedDiagram generate(FsmSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        return new GeneratedDiagram(MermaidGenerator.nameOf(spec), codec.encode(spec), getFileExtension());
    }
}
