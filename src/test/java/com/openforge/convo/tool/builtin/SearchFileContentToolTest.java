package com.openforge.convo.tool.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.llm.exception.AbortedException;
import com.openforge.convo.llm.model.ToolErrorType;
import com.openforge.convo.tool.ToolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchFileContentToolTest {

    @TempDir
    Path workspace;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(workspace.resolve("src"));
        Files.createDirectories(workspace.resolve(".git"));
        Files.writeString(workspace.resolve("src/Main.java"), "class Main {\n  // TODO wire config\n}\n");
        Files.writeString(workspace.resolve("README.md"), "Intro\nTODO: docs\n");
        Files.writeString(workspace.resolve(".git/config"), "TODO hidden\n");
    }

    @Test
    @DisplayName("Matches are reported as path:line: text, hidden directories skipped")
    void findsMatches() {
        String out = tool(200).execute(Map.of("pattern", "TODO"), new CancellationToken());

        assertTrue(out.contains("src/Main.java:2: // TODO wire config"), out);
        assertTrue(out.contains("README.md:2: TODO: docs"), out);
        assertFalse(out.contains("hidden"), out);
    }

    @Test
    @DisplayName("include restricts the searched files by glob")
    void includeGlob() {
        String out = tool(200).execute(Map.of("pattern", "TODO", "include", "*.java"), new CancellationToken());

        assertEquals("src/Main.java:2: // TODO wire config", out);
    }

    @Test
    @DisplayName("Results stop at the configured cap with a truncation note")
    void truncates() {
        String out = tool(1).execute(Map.of("pattern", "TODO"), new CancellationToken());

        assertEquals(2, out.split("\n").length);
        assertTrue(out.endsWith("[results truncated at 1 matches]"), out);
    }

    @Test
    @DisplayName("No hit is a normal answer, a bad regex is INVALID_ARGUMENTS")
    void noHitsAndBadPattern() {
        assertEquals("No matches found for pattern \"FIXME\".",
                tool(200).execute(Map.of("pattern", "FIXME"), new CancellationToken()));

        ToolException e = assertThrows(ToolException.class,
                () -> tool(200).execute(Map.of("pattern", "(unclosed"), new CancellationToken()));
        assertEquals(ToolErrorType.INVALID_ARGUMENTS, e.getType());
    }

    @Test
    @DisplayName("A cancelled session stops the walk")
    void cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel("timeout");

        assertThrows(AbortedException.class, () -> tool(200).execute(Map.of("pattern", "TODO"), token));
    }

    private SearchFileContentTool tool(int maxResults) {
        return new SearchFileContentTool(WorkspaceFixtures.properties(workspace, 1_048_576, maxResults),
                new ObjectMapper());
    }
}
