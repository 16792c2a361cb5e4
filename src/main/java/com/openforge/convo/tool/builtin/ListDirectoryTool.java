package com.openforge.convo.tool.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.config.ConvoProperties;
import com.openforge.convo.tool.ToolException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * list_directory: one entry per line, directories first and suffixed with "/".
 */
@Component
public class ListDirectoryTool extends AbstractWorkspaceTool {

    public static final String NAME = "list_directory";

    private static final String SCHEMA = """
            {
              "type":"object",
              "properties":{
                "path":{
                  "type":"string",
                  "description":"Directory path relative to the workspace root. Defaults to the root."
                }
              }
            }
            """;

    public ListDirectoryTool(ConvoProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper, NAME,
                "List the files and subdirectories of a directory in the workspace.",
                SCHEMA);
    }

    @Override
    public String execute(Map<String, Object> args, CancellationToken cancellation) {
        String pathArg = optionalString(args, "path", ".");
        Path   dir     = resolve(pathArg);
        if (!Files.isDirectory(dir)) {
            throw ToolException.failed("Directory not found: " + pathArg);
        }

        try (Stream<Path> children = Files.list(dir)) {
            List<String> entries = children
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString()))
                    .map(p -> p.getFileName() + (Files.isDirectory(p) ? "/" : ""))
                    .toList();
            if (entries.isEmpty()) {
                return "Directory " + relativize(dir) + " is empty.";
            }
            return String.join("\n", entries);
        } catch (IOException e) {
            throw ToolException.failed("Cannot list " + pathArg + ": " + e.getMessage());
        }
    }
}
