package de.bsommerfeld.updatecreator.core.error;

/**
 * Writing into the staging area or the final archive failed.
 */
public class CopyException extends UpdateCreationException {

    public CopyException(String message) {
        super(message);
    }

    public CopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
