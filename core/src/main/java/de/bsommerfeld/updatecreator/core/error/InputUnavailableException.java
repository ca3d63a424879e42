package de.bsommerfeld.updatecreator.core.error;

/**
 * The interactive input stream was closed or could not be read.
 */
public class InputUnavailableException extends UpdateCreationException {

    public InputUnavailableException(String message) {
        super(message);
    }

    public InputUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
