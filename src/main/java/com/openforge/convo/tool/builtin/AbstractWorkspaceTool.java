package com.openforge.convo.tool.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.config.ConvoProperties;
import com.openforge.convo.llm.model.FunctionDeclaration;
import com.openforge.convo.tool.Tool;
import com.openforge.convo.tool.ToolException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Base for the built-in file tools.  Every path argument is resolved against
 * the workspace root and rejected if it leaves it, symlinks included.
 */
abstract class AbstractWorkspaceTool implements Tool {

    protected final Path                  root;
    protected final ConvoProperties.Tools limits;
    private   final FunctionDeclaration   declaration;

    protected AbstractWorkspaceTool(ConvoProperties properties, ObjectMapper objectMapper,
                                    String name, String description, String schema) {
        this.limits = properties.tools();
        this.root   = realRoot(limits.root());
        try {
            JsonNode params = objectMapper.readTree(schema);
            this.declaration = new FunctionDeclaration(name, description, params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build " + name + " tool schema", e);
        }
    }

    @Override
    public FunctionDeclaration declaration() {
        return declaration;
    }

    // ── Path confinement ─────────────────────────────────────────────────────

    protected Path resolve(String relative) {
        Path candidate;
        try {
            candidate = root.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            throw ToolException.invalidArguments("Invalid path: " + relative);
        }
        if (!candidate.startsWith(root)) {
            throw ToolException.invalidArguments("Path is outside the workspace: " + relative);
        }
        if (Files.exists(candidate)) {
            try {
                if (!candidate.toRealPath().startsWith(root)) {
                    throw ToolException.invalidArguments("Path is outside the workspace: " + relative);
                }
            } catch (IOException e) {
                throw ToolException.failed("Cannot resolve " + relative + ": " + e.getMessage());
            }
        }
        return candidate;
    }

    protected String relativize(Path path) {
        String rel = root.relativize(path).toString().replace('\\', '/');
        return rel.isEmpty() ? "." : rel;
    }

    private static Path realRoot(Path configured) {
        Path absolute = configured.toAbsolutePath().normalize();
        try {
            return Files.exists(absolute) ? absolute.toRealPath() : absolute;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve workspace root " + absolute, e);
        }
    }

    // ── Argument helpers ─────────────────────────────────────────────────────

    protected static String requireString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (!(value instanceof String s) || s.isBlank()) {
            throw ToolException.invalidArguments("Missing required string argument \"" + key + "\".");
        }
        return s;
    }

    protected static String optionalString(Map<String, Object> args, String key, String fallback) {
        Object value = args.get(key);
        if (value == null) return fallback;
        if (!(value instanceof String s)) {
            throw ToolException.invalidArguments("Argument \"" + key + "\" must be a string.");
        }
        return s.isBlank() ? fallback : s;
    }

    protected static Integer optionalInt(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) return null;
        if (value instanceof Number n) {
            if (n.doubleValue() < 0 || n.doubleValue() != Math.floor(n.doubleValue())) {
                throw ToolException.invalidArguments("Argument \"" + key + "\" must be a non-negative integer.");
            }
            return n.intValue();
        }
        throw ToolException.invalidArguments("Argument \"" + key + "\" must be a number.");
    }
}
