package de.bsommerfeld.updatecreator.engine.classify;

/**
 * One file copied into the package.
 *
 * @param destination path relative to the distribution root
 * @param type        whether the file is new or replaces an existing one
 */
public record ChangeRecord(String destination, ChangeType type) {
}
