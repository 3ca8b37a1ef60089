package com.fsmkit.core.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import com.fsmkit.core.exception.FormatException;
import com.fsmkit.core.exception.FsmSpecException;
import com.fsmkit.core.model.FsmSpec;
import com.fsmkit.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads and writes {@link FsmSpec} as a flat YAML document.
 *
 * <p>The document lists the fields in record order with snake_case names. Transition
 * keys are written as {@code "(state, SYMBOL)"} strings through {@link TransitionKeys}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FsmSpecCodec codec = new FsmSpecCodec();
 * FsmSpec spec = codec.read(Paths.get("fsm_specification.yaml"));
 * String yaml = codec.encode(spec.withLabel("MyAbciApp"));
 * }</pre>
 *
 * <p>Instances are thread-safe once constructed.
 */
public class FsmSpecCodec {

    private static final Logger log = LoggerFactory.getLogger(FsmSpecCodec.class);

    private final ObjectMapper mapper;

    public FsmSpecCodec() {
        YAMLFactory factory = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
            .stringQuotingChecker(new StateNameQuotingChecker())
            .build();

        SimpleModule transitionKeys = new SimpleModule("transition-keys");
        transitionKeys.addKeySerializer(Transition.class, new TransitionKeySerializer());
        transitionKeys.addKeyDeserializer(Transition.class, new TransitionKeyDeserializer());

        this.mapper = new ObjectMapper(factory)
            .registerModule(transitionKeys);
    }

    /**
     * Serializes a spec to YAML.
     *
     * @param spec spec to serialize
     * @return YAML document
     * @throws FsmSpecException if serialization fails
     */
    public String encode(FsmSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        try {
            return mapper.writeValueAsString(spec);
        } catch (JsonProcessingException e) {
            throw new FsmSpecException("Failed to serialize FSM spec '" + spec.label() + "'", e);
        }
    }

    /**
     * Deserializes a spec from YAML.
     *
     * @param yaml YAML document
     * @return decoded spec
     * @throws FormatException if the document is malformed or misses required fields
     */
    public FsmSpec decode(String yaml) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        try {
            FsmSpec spec = mapper.readValue(yaml, FsmSpec.class);
            if (spec == null) {
                throw new FormatException("FSM spec document is empty");
            }
            return spec;
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause() instanceof FsmSpecException ? e.getCause() : e;
            throw new FormatException("Invalid FSM spec document: " + e.getOriginalMessage(), cause);
        }
    }

    /**
     * Reads a spec from a YAML file.
     *
     * @param path path to the YAML file
     * @return decoded spec
     * @throws IOException if the file cannot be read
     * @throws FormatException if the document is malformed
     */
    public FsmSpec read(Path path) throws IOException {
        log.debug("Reading FSM spec from: {}", path);
        return decode(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Writes a spec to a YAML file, replacing any existing content.
     *
     * @param spec spec to write
     * @param path target file
     * @throws IOException if the file cannot be written
     */
    public void write(FsmSpec spec, Path path) throws IOException {
        Files.writeString(path, encode(spec), StandardCharsets.UTF_8);
        log.info("Wrote FSM spec '{}' to: {}", spec.label(), path);
    }

    /**
     * Quotes strings that a YAML 1.1 reader would resolve as infinity or NaN, such as a
     * state named {@code .inf}. The default checker only covers booleans, nulls and
     * decimal or hex numbers.
     */
    static final class StateNameQuotingChecker extends StringQuotingChecker.Default {

        private static final long serialVersionUID = 1L;

        private static final Pattern SPECIAL_FLOAT = Pattern.compile("[-+]?\\.(?:inf|Inf|INF)|\\.(?:nan|NaN|NAN)");

        @Override
        public boolean needToQuoteName(String name) {
            return super.needToQuoteName(name) || isSpecialFloat(name);
        }

        @Override
        public boolean needToQuoteValue(String value) {
            return super.needToQuoteValue(value) || isSpecialFloat(value);
        }

        static boolean isSpecialFloat(String text) {
            return text != null && SPECIAL_FLOAT.matcher(text).matches();
        }
    }

    static final class TransitionKeySerializer extends JsonSerializer<Transition> {
        @Override
        public void serialize(Transition value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            gen.writeFieldName(TransitionKeys.format(value));
        }
    }

    static final class TransitionKeyDeserializer extends KeyDeserializer {
        @Override
        public Transition deserializeKey(String key, DeserializationContext ctxt) {
            return TransitionKeys.parse(key);
        }
    }
}
