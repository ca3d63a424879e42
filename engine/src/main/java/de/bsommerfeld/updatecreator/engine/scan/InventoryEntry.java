package de.bsommerfeld.updatecreator.engine.scan;

/**
 * A file or directory found in the update directory.
 *
 * @param path      path relative to the update root, {@code /}-separated
 * @param directory whether this is a directory
 * @param sha256    hex SHA-256 of the content, {@code null} for directories
 */
public record InventoryEntry(String path, boolean directory, String sha256) {

    public String name() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    public boolean isTopLevel() {
        return path.indexOf('/') < 0;
    }
}
