package de.bsommerfeld.updatecreator.core.error;

/**
 * An archive entry, file or directory could not be read while indexing, scanning or hashing.
 */
public class ReadException extends UpdateCreationException {

    public ReadException(String message) {
        super(message);
    }

    public ReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
