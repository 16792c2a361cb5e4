package com.openforge.convo.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 *   --prompt=TEXT | -p TEXT   run one non-interactive session
 *   --model=ID    | -m ID     override convo.model
 *   --help        | -h        print usage
 *
 * Bare words are joined into the prompt.  Any other "--name=value" option is
 * left to Spring (property overrides such as --convo.streaming=false).
 */
public record CliOptions(
        String  prompt,
        String  model,
        boolean help
) {

    public static final String USAGE = """
            Usage: convo [-p|--prompt TEXT] [-m|--model MODEL] [--convo.<property>=VALUE ...]

              -p, --prompt TEXT   Ask one question and exit. Piped stdin is appended to it.
              -m, --model MODEL   Model to use (default: convo.model).
              -h, --help          Show this help.

            Without --prompt, prompts are read line by line from stdin; type "exit" or "quit" to leave.
            """;

    public boolean interactive() {
        return prompt == null;
    }

    public static CliOptions parse(ApplicationArguments args) {
        String  prompt = single(args, "prompt");
        String  model  = single(args, "model");
        boolean help   = args.containsOption("help");

        List<String> words = new ArrayList<>();
        List<String> raw   = args.getNonOptionArgs();
        for (int i = 0; i < raw.size(); i++) {
            String arg = raw.get(i);
            switch (arg) {
                case "-p" -> prompt = valueAfter(raw, i++, arg);
                case "-m" -> model  = valueAfter(raw, i++, arg);
                case "-h" -> help   = true;
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new CliUsageException("Unknown option: " + arg);
                    }
                    words.add(arg);
                }
            }
        }

        if (!words.isEmpty()) {
            String joined = String.join(" ", words);
            prompt = prompt == null ? joined : prompt + " " + joined;
        }
        if (prompt != null && prompt.isBlank()) {
            throw new CliUsageException("Prompt must not be empty.");
        }
        return new CliOptions(prompt, model, help);
    }

    private static String single(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) return null;
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new CliUsageException("Option --" + name + " needs a value, e.g. --" + name + "=...");
        }
        if (values.size() > 1) {
            throw new CliUsageException("Option --" + name + " given more than once.");
        }
        return values.get(0);
    }

    private static String valueAfter(List<String> raw, int index, String flag) {
        if (index + 1 >= raw.size()) {
            throw new CliUsageException("Option " + flag + " needs a value.");
        }
        return raw.get(index + 1);
    }
}
