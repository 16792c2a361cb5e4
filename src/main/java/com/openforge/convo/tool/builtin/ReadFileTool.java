package com.openforge.convo.tool.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.config.ConvoProperties;
import com.openforge.convo.tool.ToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * read_file: returns a UTF-8 text file, optionally a window of its lines.
 *
 * { "path": "src/Main.java", "offset": 100, "limit": 50 }
 */
@Slf4j
@Component
public class ReadFileTool extends AbstractWorkspaceTool {

    public static final String NAME = "read_file";

    private static final String SCHEMA = """
            {
              "type":"object",
              "properties":{
                "path":{
                  "type":"string",
                  "description":"File path relative to the workspace root."
                },
                "offset":{
                  "type":"integer",
                  "minimum":0,
                  "description":"0-based line to start reading from."
                },
                "limit":{
                  "type":"integer",
                  "minimum":1,
                  "description":"Maximum number of lines to return."
                }
              },
              "required":["path"]
            }
            """;

    public ReadFileTool(ConvoProperties properties, ObjectMapper objectMapper) {
        super(properties, objectMapper, NAME,
                "Read the contents of a text file in the workspace. Use offset and limit for large files.",
                SCHEMA);
    }

    @Override
    public String execute(Map<String, Object> args, CancellationToken cancellation) {
        String  pathArg = requireString(args, "path");
        Integer offset  = optionalInt(args, "offset");
        Integer limit   = optionalInt(args, "limit");

        Path file = resolve(pathArg);
        if (!Files.isRegularFile(file)) {
            throw ToolException.failed("File not found: " + pathArg);
        }

        try {
            long size = Files.size(file);
            if (size > limits.maxFileBytes()) {
                throw ToolException.failed("File is too large (%d bytes, limit %d): %s"
                        .formatted(size, limits.maxFileBytes(), pathArg));
            }
            cancellation.throwIfCancelled();
            if (offset == null && limit == null) {
                return Files.readString(file, StandardCharsets.UTF_8);
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            int from = offset == null ? 0 : Math.min(offset, lines.size());
            int to   = limit == null ? lines.size() : Math.min(lines.size(), from + limit);
            return String.join("\n", lines.subList(from, to));
        } catch (CharacterCodingException e) {
            throw ToolException.failed("Not a UTF-8 text file: " + pathArg);
        } catch (IOException e) {
            log.debug("[Tool:{}] Read of {} failed", NAME, file, e);
            throw ToolException.failed("Cannot read " + pathArg + ": " + e.getMessage());
        }
    }
}
