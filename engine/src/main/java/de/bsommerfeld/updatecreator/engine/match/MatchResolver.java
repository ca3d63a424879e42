package de.bsommerfeld.updatecreator.engine.match;

import de.bsommerfeld.updatecreator.engine.tree.DistributionTree;
import de.bsommerfeld.updatecreator.engine.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Searches the distribution for every place a top-level update entry could belong.
 */
public final class MatchResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MatchResolver.class);

    /**
     * Collects every directory of the tree that has a direct child named {@code name} of
     * the given kind. The search continues below a match since the same name can appear at
     * several depths.
     */
    public MatchSet findMatches(DistributionTree tree, String name, boolean directory) {
        MatchSet matches = new MatchSet(name, directory);
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(tree.root());

        while (!pending.isEmpty()) {
            Node current = pending.pop();
            Node child = current.child(name);
            if (child != null && child.isDirectory() == directory) {
                matches.add(current);
            }
            for (Node next : current.children()) {
                if (next.isDirectory()) {
                    pending.push(next);
                }
            }
        }

        LOG.debug("Matches for {}: {}", name, matches);
        return matches;
    }
}
