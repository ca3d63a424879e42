package de.bsommerfeld.updatecreator.core.event;

/**
 * Events published while update entries are placed into the package.
 */
public class PlacementEvents {

    /**
     * A file was copied into the staging area.
     *
     * @param destination path relative to the distribution root
     * @param modified    {@code true} if it replaces a file of the distribution
     */
    public record FileCopiedEvent(String destination, boolean modified) {
    }

    /**
     * A file was left out because the distribution already ships identical content.
     */
    public record UnchangedFileSkippedEvent(String destination) {
    }

    /**
     * A top-level entry of the update was not copied at all.
     */
    public record EntrySkippedEvent(String name, String reason) {
    }

    /**
     * An optional resource file was not present in the update directory.
     */
    public record ResourceFileMissingEvent(String name) {
    }
}
