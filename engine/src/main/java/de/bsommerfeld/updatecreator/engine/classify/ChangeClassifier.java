package de.bsommerfeld.updatecreator.engine.classify;

import de.bsommerfeld.updatecreator.core.error.CopyException;
import de.bsommerfeld.updatecreator.core.event.ApplicationEventBus;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.FileCopiedEvent;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.UnchangedFileSkippedEvent;
import de.bsommerfeld.updatecreator.engine.scan.InventoryEntry;
import de.bsommerfeld.updatecreator.engine.stage.StagingArea;
import de.bsommerfeld.updatecreator.engine.tree.DistributionTree;
import de.bsommerfeld.updatecreator.engine.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Copies single files into the staging area and records whether each one is new to the
 * distribution or replaces one of its files.
 */
public final class ChangeClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeClassifier.class);

    private final DistributionTree tree;
    private final StagingArea staging;
    private final ChangeManifest manifest;
    private final ApplicationEventBus eventBus;
    private final boolean checkHash;

    public ChangeClassifier(DistributionTree tree, StagingArea staging, ChangeManifest manifest,
                            ApplicationEventBus eventBus, boolean checkHash) {
        this.tree = tree;
        this.staging = staging;
        this.manifest = manifest;
        this.eventBus = eventBus;
        this.checkHash = checkHash;
    }

    /**
     * Copies {@code source} to {@code destination}.
     *
     * @param source           file of the update inventory
     * @param destination      target path relative to the distribution root
     * @param unambiguous      whether the destination came from a single match; only then
     *                         is a file with identical content left out
     * @return the recorded change, empty if the file was left out
     * @throws CopyException   if writing the staging area fails
     */
    public Optional<ChangeRecord> copy(InventoryEntry source, String destination, boolean unambiguous)
            throws CopyException {
        if (checkHash && unambiguous && tree.hashMatches(destination, source.sha256())) {
            LOG.debug("Hash of {} matches the distribution, ignoring file", destination);
            eventBus.post(new UnchangedFileSkippedEvent(destination));
            return Optional.empty();
        }

        staging.copy(source.path(), destination);

        Node existing = tree.find(destination);
        ChangeType type = existing != null && !existing.isDirectory() ? ChangeType.MODIFIED : ChangeType.ADDED;
        ChangeRecord record = new ChangeRecord(destination, type);
        manifest.record(record);
        eventBus.post(new FileCopiedEvent(destination, type == ChangeType.MODIFIED));
        return Optional.of(record);
    }
}
