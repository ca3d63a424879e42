package de.bsommerfeld.updatecreator.engine.place;

import de.bsommerfeld.updatecreator.core.error.InputUnavailableException;

/**
 * Line-oriented conversation with the person building the update.
 */
public interface Prompter {

    /**
     * Prints {@code question} and blocks until a line is entered.
     *
     * @return the entered line without its line terminator, never {@code null}
     * @throws InputUnavailableException if the input is closed or cannot be read
     */
    String ask(String question) throws InputUnavailableException;

    /**
     * Prints an informational message or error on its own line.
     */
    void show(String message);
}
