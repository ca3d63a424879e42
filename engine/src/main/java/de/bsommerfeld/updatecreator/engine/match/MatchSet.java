package de.bsommerfeld.updatecreator.engine.match;

import de.bsommerfeld.updatecreator.engine.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribution directories that directly contain an entry with the searched name and kind,
 * keyed by their relative path. The empty key stands for the distribution root.
 */
public final class MatchSet {

    private final String name;
    private final boolean directory;
    private final Map<String, Node> locations = new HashMap<>();

    MatchSet(String name, boolean directory) {
        this.name = name;
        this.directory = directory;
    }

    void add(Node location) {
        locations.put(location.relativePath(), location);
    }

    public String name() {
        return name;
    }

    public boolean isDirectory() {
        return directory;
    }

    public int size() {
        return locations.size();
    }

    public boolean isEmpty() {
        return locations.isEmpty();
    }

    public boolean contains(String relativePath) {
        return locations.containsKey(relativePath);
    }

    public Map<String, Node> locations() {
        return Collections.unmodifiableMap(locations);
    }

    /**
     * Matched locations in lexicographic order, the order they are offered to the user.
     */
    public List<String> sortedPaths() {
        List<String> paths = new ArrayList<>(locations.keySet());
        Collections.sort(paths);
        return paths;
    }

    @Override
    public String toString() {
        return name + (directory ? "/ " : " ") + sortedPaths();
    }
}
