package com.openforge.convo.tool.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.config.ConvoProperties;
import com.openforge.convo.tool.ToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * search_file_content: regex search over the text files below a directory.
 *
 * Output is one "path:line: text" row per match, capped at
 * {@code convo.tools.max-search-results}.  Hidden directories, oversized and
 * binary files are skipped.
 */
@Slf4j
@Component
public class SearchFileContentTool extends AbstractWorkspaceTool {

    public static final String NAME = "search_file_content";

    private static final int MAX_LINE_CHARS = 300;

    private static final String SCHEMA = """
            {
              "type":"object",
              "properties":{
                "pattern":{
                  "type":"string",
                  "description":"Java regular expression to search for."
                },
                "path":{
                  "type":"string",
                  "description":"Directory to search, relative to the workspace root. Defaults to the root."
                },
                "include":{
                  "type":"string",
                  "description":"Optional glob restricting which files are searched, e.g. *.java"
                }
              },
              "required":["pattern"]
            }
            """;

    public SearchFileContentTool(ConvoProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper, NAME,
                "Search file contents in the workspace with a regular expression.",
                SCHEMA);
    }

    @Override
    public String execute(Map<String, Object> args, CancellationToken cancellation) {
        String patternArg = requireString(args, "pattern");
        String pathArg    = optionalString(args, "path", ".");
        String include    = optionalString(args, "include", null);

        Pattern pattern;
        try {
            pattern = Pattern.compile(patternArg);
        } catch (PatternSyntaxException e) {
            throw ToolException.invalidArguments("Invalid regular expression: " + e.getDescription());
        }
        PathMatcher matcher = include == null ? null
                : FileSystems.getDefault().getPathMatcher("glob:" + include);

        Path dir = resolve(pathArg);
        if (!Files.isDirectory(dir)) {
            throw ToolException.failed("Directory not found: " + pathArg);
        }

        List<String> hits = new ArrayList<>();
        boolean truncated = false;
        try (Stream<Path> files = Files.walk(dir)) {
            for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                cancellation.throwIfCancelled();
                if (isHidden(dir, file)) continue;
                if (matcher != null && !matcher.matches(file.getFileName())) continue;
                if (!searchFile(file, pattern, hits)) {
                    truncated = true;
                    break;
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw ToolException.failed("Search failed: " + e.getMessage());
        }

        if (hits.isEmpty()) {
            return "No matches found for pattern \"" + patternArg + "\".";
        }
        String body = String.join("\n", hits);
        return truncated ? body + "\n[results truncated at " + limits.maxSearchResults() + " matches]" : body;
    }

    /** Returns false once the result cap is reached. */
    private boolean searchFile(Path file, Pattern pattern, List<String> hits) {
        List<String> lines;
        try {
            if (Files.size(file) > limits.maxFileBytes()) return true;
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            // binary or unreadable
            log.trace("[Tool:{}] Skipping {}: {}", NAME, file, e.toString());
            return true;
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher m = pattern.matcher(line);
            if (!m.find()) continue;
            if (hits.size() >= limits.maxSearchResults()) return false;
            String text = line.length() > MAX_LINE_CHARS ? line.substring(0, MAX_LINE_CHARS) + "..." : line;
            hits.add(relativize(file) + ":" + (i + 1) + ": " + text.strip());
        }
        return true;
    }

    private static boolean isHidden(Path base, Path file) {
        for (Path part : base.relativize(file)) {
            if (part.toString().startsWith(".")) return true;
        }
        return false;
    }
}
