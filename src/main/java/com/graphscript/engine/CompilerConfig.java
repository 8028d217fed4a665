package com.graphscript.engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Compiler settings.
 *
 * <p>
 * Can be read from JSON, e.g.
 *
 * <pre>
 * { "disableRecursiveFunctions": true, "maxInlineDepth": 64,
 *   "temporaryPrefix": "var_", "argumentPrefix": "arg_" }
 * </pre>
 *
 * Unknown keys are ignored; missing keys keep their defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CompilerConfig {
    /** Classpath resource read by {@link #load()}. */
    public static final String RESOURCE = "graphscript.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Reject a Function node whose callee is already being inlined, with
     * RECURSIVE_FUNCTION_DISABLED.
     *
     * <p>
     * Calls are inlined and every branch is expanded, so a recursive call graph
     * never compiles: with this flag cleared it fails with
     * INLINE_DEPTH_EXCEEDED once {@link #maxInlineDepth} is reached. Clearing
     * it only changes the reported error.
     */
    private boolean disableRecursiveFunctions = true;

    /** Maximum nesting of inlined calls, Main excluded. */
    private int maxInlineDepth = 64;

    private String temporaryPrefix = "var_";
    private String argumentPrefix = "arg_";

    public static CompilerConfig defaults() {
        return new CompilerConfig();
    }

    /** Reads {@value #RESOURCE} from the classpath, or returns the defaults when absent. */
    public static CompilerConfig load() {
        try (InputStream in = CompilerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
                return defaults();
            }
            return validate(MAPPER.readValue(in, CompilerConfig.class));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
    }

    public static CompilerConfig load(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static CompilerConfig parse(String json) throws IOException {
        return validate(MAPPER.readValue(json, CompilerConfig.class));
    }

    private static CompilerConfig validate(CompilerConfig c) {
        if (c.maxInlineDepth < 1)
            throw new IllegalArgumentException("maxInlineDepth must be positive: " + c.maxInlineDepth);
        if (c.temporaryPrefix == null || c.temporaryPrefix.isEmpty())
            throw new IllegalArgumentException("temporaryPrefix must not be empty");
        if (c.argumentPrefix == null || c.argumentPrefix.isEmpty())
            throw new IllegalArgumentException("argumentPrefix must not be empty");
        return c;
    }
}
