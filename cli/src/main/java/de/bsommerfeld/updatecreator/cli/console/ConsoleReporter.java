package de.bsommerfeld.updatecreator.cli.console;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.EntrySkippedEvent;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.FileCopiedEvent;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.ResourceFileMissingEvent;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.UnchangedFileSkippedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints placement events for the user.
 */
public final class ConsoleReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ConsoleReporter.class);

    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    @Subscribe
    public void onFileCopied(FileCopiedEvent event) {
        LOG.debug("Copied {} (modified: {})", event.destination(), event.modified());
        out.println((event.modified() ? "[MODIFIED] " : "[ADDED]    ") + event.destination());
    }

    @Subscribe
    public void onUnchangedFile(UnchangedFileSkippedEvent event) {
        out.println("[UNCHANGED] " + event.destination());
    }

    @Subscribe
    public void onEntrySkipped(EntrySkippedEvent event) {
        LOG.info("Skipped {}: {}", event.name(), event.reason());
        out.println("[SKIPPED] " + event.name() + " (" + event.reason() + ")");
    }

    @Subscribe
    public void onResourceFileMissing(ResourceFileMissingEvent event) {
        out.println("Optional resource file '" + event.name() + "' not found.");
    }
}
