package de.bsommerfeld.updatecreator.engine.place;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Locations picked from a numbered list.
 *
 * @param skip    the user entered {@code 0}
 * @param indices distinct 1-based indices in the order they were entered
 */
public record Selection(boolean skip, List<Integer> indices) {

    private static final Selection SKIP = new Selection(true, List.of());

    public Selection {
        indices = List.copyOf(indices);
    }

    /**
     * Parses a comma separated list of indices for a list of {@code count} locations.
     * Any {@code 0} in the list means skip, whatever else was entered.
     *
     * @throws InvalidSelectionException if an entry is not a number or outside {@code [1, count]}
     */
    public static Selection parse(String input, int count) throws InvalidSelectionException {
        String[] tokens = input.trim().split(",");
        List<Integer> parsed = new ArrayList<>();
        boolean malformed = false;
        for (String token : tokens) {
            try {
                parsed.add(Integer.parseInt(token.trim()));
            } catch (NumberFormatException e) {
                malformed = true;
            }
        }
        if (parsed.contains(0)) {
            return SKIP;
        }
        if (malformed || parsed.isEmpty()) {
            throw new InvalidSelectionException(outOfRange(count));
        }
        Set<Integer> distinct = new LinkedHashSet<>();
        for (int index : parsed) {
            if (index < 1 || index > count) {
                throw new InvalidSelectionException(outOfRange(count));
            }
            distinct.add(index);
        }
        return new Selection(false, new ArrayList<>(distinct));
    }

    private static String outOfRange(int count) {
        return "Invalid preferences. Please select indices where 0 <= index <= " + count;
    }
}
