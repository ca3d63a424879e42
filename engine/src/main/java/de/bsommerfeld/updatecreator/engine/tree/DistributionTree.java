package de.bsommerfeld.updatecreator.engine.tree;

import de.bsommerfeld.updatecreator.core.util.RelativePaths;

/**
 * The indexed baseline distribution. Lookups walk the path one segment at a time.
 */
public final class DistributionTree {

    private final Node root;

    DistributionTree(Node root) {
        this.root = root;
    }

    public Node root() {
        return root;
    }

    /**
     * Node at {@code relativePath}, the root for an empty path, {@code null} if absent.
     */
    public Node find(String relativePath) {
        Node current = root;
        for (String segment : RelativePaths.segments(relativePath)) {
            current = current.child(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public boolean exists(String relativePath, boolean directory) {
        Node node = find(relativePath);
        return node != null && node.isDirectory() == directory;
    }

    /**
     * Whether a file with the given content hash exists at {@code relativePath}.
     */
    public boolean hashMatches(String relativePath, String sha256) {
        Node node = find(relativePath);
        return node != null && !node.isDirectory() && node.sha256() != null
                && node.sha256().equalsIgnoreCase(sha256);
    }
}
