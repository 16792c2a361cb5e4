package com.openforge.convo.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.junit.jupiter.api.Assertions.*;

class CliOptionsTest {

    @Test
    @DisplayName("--prompt and --model are read as options")
    void longOptions() {
        CliOptions options = parse("--prompt=Summarize README.md", "--model=gpt-4o");

        assertEquals("Summarize README.md", options.prompt());
        assertEquals("gpt-4o", options.model());
        assertFalse(options.interactive());
        assertFalse(options.help());
    }

    @Test
    @DisplayName("Short flags take the next word as their value; bare words join the prompt")
    void shortFlagsAndBareWords() {
        CliOptions options = parse("-m", "ollama/llama3.1", "explain", "this", "repo");

        assertEquals("ollama/llama3.1", options.model());
        assertEquals("explain this repo", options.prompt());
    }

    @Test
    @DisplayName("No prompt means interactive mode; Spring property overrides are ignored")
    void interactive() {
        CliOptions options = parse("--convo.streaming=false");

        assertTrue(options.interactive());
        assertNull(options.model());
    }

    @Test
    @DisplayName("-h and --help request usage")
    void help() {
        assertTrue(parse("-h").help());
        assertTrue(parse("--help").help());
    }

    @Test
    @DisplayName("Unknown flags, missing values and blank prompts are usage errors")
    void usageErrors() {
        assertEquals("Unknown option: -x", assertThrows(CliUsageException.class, () -> parse("-x")).getMessage());
        assertThrows(CliUsageException.class, () -> parse("-p"));
        assertThrows(CliUsageException.class, () -> parse("--prompt="));
        assertThrows(CliUsageException.class, () -> parse("--model=a", "--model=b"));
        assertThrows(CliUsageException.class, () -> parse("-p", "  "));
    }

    private static CliOptions parse(String... args) {
        return CliOptions.parse(new DefaultApplicationArguments(args));
    }
}
