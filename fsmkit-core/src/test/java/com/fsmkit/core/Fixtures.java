package com.fsmkit.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads text fixtures from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String HELLO_WORLD_YAML = "hello_world_abci.yaml";
    public static final String ARBITRAGE_STATE_DIAGRAM = "arbitrage_state_diagram.mmd";

    private Fixtures() {
        // Utility class
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
