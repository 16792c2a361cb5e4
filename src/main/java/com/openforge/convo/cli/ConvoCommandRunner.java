package com.openforge.convo.cli;

import com.openforge.convo.agent.CancellationToken;
import com.openforge.convo.agent.Session;
import com.openforge.convo.agent.SessionFactory;
import com.openforge.convo.agent.SessionOutcome;
import com.openforge.convo.agent.TurnOrchestrator;
import com.openforge.convo.config.ConvoProperties;
import com.openforge.convo.llm.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Command-line entry point.
 *
 *   --prompt given   one session, guarded by the watchdog, exit code from its outcome
 *   no --prompt      read prompts from stdin, one session each, until exit/quit/EOF
 *
 * Ctrl-C cancels the running session through {@link InterruptHandler}; the
 * session ends ABORTED and the process exits with 130.
 *
 * Disabled with convo.cli.enabled=false (tests).
 */
@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "convo.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConvoCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ConvoProperties  properties;
    private final SessionFactory   sessionFactory;
    private final TurnOrchestrator orchestrator;
    private final SessionWatchdog  watchdog;
    private final InterruptHandler interrupts;

    private volatile int exitCode = ExitCodes.COMPLETED;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args, System.in, System.out, System.err, stdinHasData());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args, InputStream in, PrintStream out, PrintStream err, boolean stdinPiped) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (CliUsageException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return ExitCodes.USAGE;
        }
        if (options.help()) {
            out.println(CliOptions.USAGE);
            return ExitCodes.COMPLETED;
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            if (options.interactive()) {
                return interactive(options, reader, out, err);
            }
            String prompt = options.prompt();
            if (stdinPiped) {
                String piped = readAll(reader);
                if (!piped.isBlank()) prompt = prompt + "\n\n" + piped;
            }
            return single(options, prompt, out, err);
        } catch (ConfigurationException e) {
            log.error("[CLI] Configuration error: {}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return ExitCodes.USAGE;
        }
    }

    // ── Modes ────────────────────────────────────────────────────────────────

    private int single(CliOptions options, String prompt, PrintStream out, PrintStream err) {
        CancellationToken cancellation = new CancellationToken();
        ConvoProperties.Session limits = properties.session();

        try (Session session = sessionFactory.create(options.model(), cancellation);
             SessionWatchdog.Armed armed = watchdog.arm(cancellation, limits.timeout(), limits.shutdownGrace());
             InterruptHandler.Guard guard = interrupts.guard(cancellation, limits.shutdownGrace())) {
            SessionOutcome outcome = orchestrator.run(session, prompt, new ConsoleEventPublisher(out, err, false));
            int code = ExitCodes.of(outcome, armed.timedOut());
            log.info("[CLI] Session {} ended {} after {} turn(s); exit {}",
                    outcome.sessionId(), outcome.status(), outcome.turns(), code);
            return code;
        }
    }

    private int interactive(CliOptions options, BufferedReader reader, PrintStream out, PrintStream err) {
        ConsoleEventPublisher console = new ConsoleEventPublisher(out, err, false);
        while (true) {
            err.print("> ");
            err.flush();
            String line = readLine(reader);
            if (line == null) break;
            line = line.strip();
            if (line.isEmpty()) continue;
            if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) break;

            CancellationToken cancellation = new CancellationToken();
            try (Session session = sessionFactory.create(options.model(), cancellation);
                 InterruptHandler.Guard guard = interrupts.guard(cancellation, properties.session().shutdownGrace())) {
                orchestrator.run(session, line, console);
            }
        }
        return ExitCodes.COMPLETED;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Piped input that is already waiting; a terminal or an empty pipe reads as none. */
    private static boolean stdinHasData() {
        if (System.console() != null) return false;
        try {
            return System.in.available() > 0;
        } catch (IOException e) {
            log.debug("[CLI] Cannot probe stdin: {}", e.getMessage());
            return false;
        }
    }

    private static String readLine(BufferedReader reader) {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stdin", e);
        }
    }

    private static String readAll(BufferedReader reader) {
        StringBuilder sb = new StringBuilder();
        String line;
        while ((line = readLine(reader)) != null) {
            sb.append(line).append('\n');
        }
        return sb.toString().strip();
    }
}
