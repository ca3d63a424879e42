package de.bsommerfeld.updatecreator.engine.place;

/**
 * States an update entry passes through while its destination is decided.
 */
public enum PlacementState {

    SEARCHING,
    NO_MATCH,
    SINGLE_MATCH,
    MULTIPLE_MATCH,
    /** Waiting for a destination directory for content the distribution does not have. */
    AWAITING_DESTINATION,
    /** The entered destination does not exist; waiting for yes, no or re-enter. */
    AWAITING_CONFIRMATION,
    /** Waiting for indices out of the list of matched locations. */
    AWAITING_SELECTION,
    COPYING,
    DONE,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == SKIPPED;
    }
}
