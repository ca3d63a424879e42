package de.bsommerfeld.updatecreator.core.error;

/**
 * Thrown when creating an update package fails unrecoverably.
 * The staging area of a run that ended with this exception must be discarded.
 */
public class UpdateCreationException extends Exception {

    public UpdateCreationException(String message) {
        super(message);
    }

    public UpdateCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
