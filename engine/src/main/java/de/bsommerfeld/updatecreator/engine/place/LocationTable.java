package de.bsommerfeld.updatecreator.engine.place;

import de.bsommerfeld.updatecreator.core.util.RelativePaths;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders matched locations as a numbered table.
 */
final class LocationTable {

    private static final String INDEX_HEADER = "INDEX";
    private static final String LOCATION_HEADER = "MATCHING LOCATION";
    private static final String CARBON_HOME = "CARBON_HOME";

    private LocationTable() {
    }

    static String render(String name, List<String> sortedPaths) {
        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < sortedPaths.size(); i++) {
            String location = RelativePaths.join(RelativePaths.join(CARBON_HOME, sortedPaths.get(i)), name);
            rows.add(new String[]{String.valueOf(i + 1), location});
        }

        int indexWidth = INDEX_HEADER.length();
        int locationWidth = LOCATION_HEADER.length();
        for (String[] row : rows) {
            indexWidth = Math.max(indexWidth, row[0].length());
            locationWidth = Math.max(locationWidth, row[1].length());
        }

        String border = "+" + "-".repeat(indexWidth + 2) + "+" + "-".repeat(locationWidth + 2) + "+";
        String format = "| %-" + indexWidth + "s | %-" + locationWidth + "s |";

        StringBuilder table = new StringBuilder();
        table.append(border).append('\n');
        table.append(String.format(format, INDEX_HEADER, LOCATION_HEADER)).append('\n');
        table.append(border).append('\n');
        for (String[] row : rows) {
            table.append(String.format(format, row[0], row[1])).append('\n');
        }
        table.append(border);
        return table.toString();
    }
}
