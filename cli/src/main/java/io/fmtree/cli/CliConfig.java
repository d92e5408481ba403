package io.fmtree.cli;

import java.nio.file.Path;

/**
 * Command line options parsed from args.
 *
 * Supports:
 *  - configPath: JSON tree description to load
 *  - command:    root | proof | index-of
 *  - argument:   leaf index for proof, element for index-of
 *  - help:       print usage and exit
 */
public record CliConfig(
        Path configPath,
        String command,
        String argument,
        boolean help
) {

    public static final String USAGE = """
            Usage:
              fmtree-cli --config <tree.json> root
              fmtree-cli --config <tree.json> proof <index>
              fmtree-cli --config <tree.json> index-of <element>

            Options:
              --config, -c   Path to JSON tree description (required)
              --help,   -h   Show this help message
            """;

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --config, -c <path>
     *   --help,   -h
     * followed by a command and its argument.
     *
     * @throws UsageException on unknown flags, missing values or a bad command shape
     */
    public static CliConfig fromArgs(String[] args) {
        Path configPath = null;
        String command = null;
        String argument = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliConfig(null, null, null, true);
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = Path.of(args[++i]);
                }

                default -> {
                    if (args[i].startsWith("-") && command == null) {
                        throw new UsageException("unknown option: " + args[i]);
                    }
                    if (command == null) {
                        command = args[i];
                    } else if (argument == null) {
                        argument = args[i];
                    } else {
                        throw new UsageException("unexpected argument: " + args[i]);
                    }
                }
            }
        }

        if (command == null) throw new UsageException("missing command");
        if (configPath == null) throw new UsageException("--config is required");

        switch (command) {
            case "root" -> {
                if (argument != null) throw new UsageException("root takes no argument");
            }
            case "proof" -> {
                if (argument == null) throw new UsageException("proof requires <index>");
            }
            case "index-of" -> {
                if (argument == null) throw new UsageException("index-of requires <element>");
            }
            default -> throw new UsageException("unknown command: " + command);
        }
        return new CliConfig(configPath, command, argument, false);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new UsageException("missing value for option: " + args[i]);
        }
    }

    /** Bad command line; the message is shown together with the usage text. */
    public static final class UsageException extends RuntimeException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
