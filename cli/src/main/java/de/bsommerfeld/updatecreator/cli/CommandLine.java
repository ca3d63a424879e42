package de.bsommerfeld.updatecreator.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command-line arguments.
 *
 * @param command       {@code create}, {@code init} or {@code help}
 * @param arguments     positional arguments after the command
 * @param skipHashCheck {@code -m}: copy files even if the distribution has identical content
 * @param debug         {@code -d}: debug logging
 * @param trace         {@code -t}: trace logging
 */
public record CommandLine(String command, List<String> arguments, boolean skipHashCheck,
                          boolean debug, boolean trace) {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  update-creator create <update_dir> <dist_loc> [-m|--skip-hash-check] [-d|--debug] [-t|--trace]",
            "      Create a new update zip from the files in <update_dir>. The distribution zip at",
            "      <dist_loc> is used to find where each file belongs.",
            "  update-creator init [dir]",
            "      Write an empty update-descriptor.yaml to [dir] (default: current directory).");

    public CommandLine {
        arguments = List.copyOf(arguments);
    }

    /**
     * @throws IllegalArgumentException for unknown options or a missing command
     */
    public static CommandLine parse(String[] args) {
        String command = null;
        List<String> positional = new ArrayList<>();
        boolean skipHashCheck = false;
        boolean debug = false;
        boolean trace = false;

        for (String arg : args) {
            switch (arg) {
                case "-m", "--skip-hash-check" -> skipHashCheck = true;
                case "-d", "--debug" -> debug = true;
                case "-t", "--trace" -> trace = true;
                case "-h", "--help" -> command = "help";
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (command == null) {
                        command = arg;
                    } else {
                        positional.add(arg);
                    }
                }
            }
        }
        if (command == null) {
            throw new IllegalArgumentException("No command given.");
        }
        return new CommandLine(command, positional, skipHashCheck, debug, trace);
    }
}
