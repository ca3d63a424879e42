package de.bsommerfeld.updatecreator.engine.place;

import java.util.Locale;

/**
 * Answer to a yes/no(/re-enter) question.
 */
public enum Preference {

    YES,
    NO,
    REENTER,
    INVALID;

    /**
     * Interprets a raw answer. Surrounding whitespace and case are ignored; an empty
     * answer yields {@code whenEmpty}.
     */
    public static Preference parse(String answer, Preference whenEmpty) {
        String normalized = answer == null ? "" : answer.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "":
                return whenEmpty;
            case "y":
            case "yes":
                return YES;
            case "n":
            case "no":
                return NO;
            case "r":
            case "reenter":
            case "re-enter":
                return REENTER;
            default:
                return INVALID;
        }
    }
}
