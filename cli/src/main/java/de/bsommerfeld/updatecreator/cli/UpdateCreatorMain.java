package de.bsommerfeld.updatecreator.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.updatecreator.cli.config.CreatorModule;
import de.bsommerfeld.updatecreator.cli.console.ConsolePrompter;
import de.bsommerfeld.updatecreator.cli.console.ConsoleReporter;
import de.bsommerfeld.updatecreator.core.config.ConfigLoader;
import de.bsommerfeld.updatecreator.core.config.CreatorConfig;
import de.bsommerfeld.updatecreator.core.descriptor.UpdateDescriptorIO;
import de.bsommerfeld.updatecreator.core.error.UpdateCreationException;
import de.bsommerfeld.updatecreator.core.event.ApplicationEventBus;
import de.bsommerfeld.updatecreator.core.util.StorageUtils;
import de.bsommerfeld.updatecreator.engine.CreationResult;
import de.bsommerfeld.updatecreator.engine.UpdateCreator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * <h3>Exit codes</h3>
 * {@code 0} on success, {@code 1} for invalid arguments and for any failure while creating
 * the update. A failed run leaves no update zip behind.
 */
public final class UpdateCreatorMain {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateCreatorMain.class);

    private UpdateCreatorMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        CommandLine commandLine;
        try {
            commandLine = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CommandLine.USAGE);
            return 1;
        }
        LogLevels.apply(commandLine.debug(), commandLine.trace());

        switch (commandLine.command()) {
            case "create":
                return create(commandLine, in, out, err);
            case "init":
                return init(commandLine, out, err);
            case "help":
                out.println(CommandLine.USAGE);
                return 0;
            default:
                err.println("Unknown command: " + commandLine.command());
                err.println(CommandLine.USAGE);
                return 1;
        }
    }

    private static int create(CommandLine commandLine, InputStream in, PrintStream out, PrintStream err) {
        if (commandLine.arguments().size() != 2) {
            err.println("Invalid number of arguments. Run 'update-creator --help' to view help.");
            return 1;
        }
        CreatorConfig config;
        try {
            config = new ConfigLoader().load(StorageUtils.getConfigFile());
        } catch (IOException e) {
            LOG.error("Failed to load configuration", e);
            err.println("Failed to load configuration: " + e.getMessage());
            return 1;
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        Injector injector = Guice.createInjector(new CreatorModule(config, new ConsolePrompter(reader, out)));
        injector.getInstance(ApplicationEventBus.class).register(new ConsoleReporter(out));

        boolean checkHash = config.isCheckHash() && !commandLine.skipHashCheck();
        Path updateDirectory = Paths.get(commandLine.arguments().get(0));
        Path distribution = Paths.get(commandLine.arguments().get(1));
        try {
            CreationResult result = injector.getInstance(UpdateCreator.class)
                    .create(updateDirectory, distribution, checkHash);
            out.println("'" + result.archive().getFileName() + "' successfully created.");
            return 0;
        } catch (UpdateCreationException e) {
            LOG.debug("Creating the update failed", e);
            err.println("[ERROR] " + e.getMessage());
            return 1;
        }
    }

    private static int init(CommandLine commandLine, PrintStream out, PrintStream err) {
        if (commandLine.arguments().size() > 1) {
            err.println("Invalid number of arguments. Run 'update-creator --help' to view help.");
            return 1;
        }
        Path directory = commandLine.arguments().isEmpty()
                ? Paths.get(".")
                : Paths.get(commandLine.arguments().get(0));
        try {
            Path file = new UpdateDescriptorIO().writeTemplate(directory);
            out.println("'" + file + "' created.");
            return 0;
        } catch (UpdateCreationException e) {
            LOG.debug("Init failed", e);
            err.println("[ERROR] " + e.getMessage());
            return 1;
        }
    }
}
