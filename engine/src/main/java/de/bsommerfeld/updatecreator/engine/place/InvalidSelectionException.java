package de.bsommerfeld.updatecreator.engine.place;

/**
 * A location selection could not be parsed or referenced a location that does not exist.
 * The user is asked again; this never ends a run.
 */
public class InvalidSelectionException extends Exception {

    public InvalidSelectionException(String message) {
        super(message);
    }
}
