package de.bsommerfeld.updatecreator.core.error;

/**
 * The update descriptor is missing, unparsable or fails validation.
 */
public class DescriptorException extends UpdateCreationException {

    public DescriptorException(String message) {
        super(message);
    }

    public DescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
