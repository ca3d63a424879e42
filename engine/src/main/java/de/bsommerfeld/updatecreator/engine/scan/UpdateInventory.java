package de.bsommerfeld.updatecreator.engine.scan;

import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Result of scanning the update directory. Entries are keyed and ordered by relative path;
 * the top-level directory and file names are kept separately because they are the units
 * the distribution is searched for.
 */
public final class UpdateInventory {

    private final NavigableMap<String, InventoryEntry> entries;
    private final NavigableSet<String> rootDirectoryNames;
    private final NavigableSet<String> rootFileNames;

    UpdateInventory(TreeMap<String, InventoryEntry> entries,
                    TreeSet<String> rootDirectoryNames,
                    TreeSet<String> rootFileNames) {
        this.entries = Collections.unmodifiableNavigableMap(entries);
        this.rootDirectoryNames = Collections.unmodifiableNavigableSet(rootDirectoryNames);
        this.rootFileNames = Collections.unmodifiableNavigableSet(rootFileNames);
    }

    public NavigableMap<String, InventoryEntry> entries() {
        return entries;
    }

    public InventoryEntry get(String relativePath) {
        return entries.get(relativePath);
    }

    public NavigableSet<String> rootDirectoryNames() {
        return rootDirectoryNames;
    }

    public NavigableSet<String> rootFileNames() {
        return rootFileNames;
    }

    /**
     * Every file below the top-level directory {@code name}, at any depth.
     */
    public List<InventoryEntry> filesUnder(String name) {
        String prefix = name + "/";
        return entries.tailMap(prefix, true).values().stream()
                .takeWhile(e -> e.path().startsWith(prefix))
                .filter(e -> !e.directory())
                .collect(Collectors.toList());
    }
}
