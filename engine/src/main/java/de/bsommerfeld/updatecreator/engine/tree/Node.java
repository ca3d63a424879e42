package de.bsommerfeld.updatecreator.engine.tree;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * One file or directory of the baseline distribution.
 *
 * <p>A node owns its children through a name-keyed map. The parent reference is only
 * followed to rebuild {@link #relativePath()}. Nodes are mutated by
 * {@link DistributionIndexer} while the tree is built and are read-only afterwards.
 */
public final class Node {

    private final String name;
    private final Node parent;
    private final Map<String, Node> children = new HashMap<>();
    private boolean directory;
    private String sha256;

    private Node(String name, Node parent, boolean directory, String sha256) {
        this.name = name;
        this.parent = parent;
        this.directory = directory;
        this.sha256 = sha256;
    }

    static Node root() {
        return new Node("", null, true, null);
    }

    /**
     * Returns the child called {@code name}, creating a directory placeholder if absent.
     */
    Node childOrPlaceholder(String name) {
        return children.computeIfAbsent(name, n -> new Node(n, this, true, null));
    }

    /**
     * Applies the kind and hash declared by an archive entry.
     */
    void declare(boolean directory, String sha256) {
        this.directory = directory;
        this.sha256 = directory ? null : sha256;
    }

    public String name() {
        return name;
    }

    public boolean isDirectory() {
        return directory;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Hex SHA-256 of the file content, {@code null} for directories.
     */
    public String sha256() {
        return sha256;
    }

    public Node child(String name) {
        return children.get(name);
    }

    public Collection<Node> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    /**
     * Path from the distribution root, {@code /}-separated. Empty for the root.
     */
    public String relativePath() {
        Deque<String> names = new ArrayDeque<>();
        for (Node node = this; node.parent != null; node = node.parent) {
            names.push(node.name);
        }
        return String.join("/", names);
    }

    @Override
    public String toString() {
        return (directory ? "dir:" : "file:") + relativePath();
    }
}
