package de.bsommerfeld.updatecreator.cli.console;

import de.bsommerfeld.updatecreator.core.error.InputUnavailableException;
import de.bsommerfeld.updatecreator.engine.place.Prompter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * {@link Prompter} on top of a terminal: questions go to {@code out}, answers are read line
 * by line from {@code in}.
 */
public final class ConsolePrompter implements Prompter {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public String ask(String question) throws InputUnavailableException {
        out.print(question);
        out.flush();
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new InputUnavailableException("Error occurred while getting input from the user.", e);
        }
        if (line == null) {
            throw new InputUnavailableException("Input closed while waiting for an answer to: " + question.trim());
        }
        return line;
    }

    @Override
    public void show(String message) {
        out.println(message);
    }
}
