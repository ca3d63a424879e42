package de.bsommerfeld.updatecreator.engine.classify;

public enum ChangeType {
    /** No file of the distribution exists at the destination. */
    ADDED,
    /** The copy replaces a file of the distribution. */
    MODIFIED
}
