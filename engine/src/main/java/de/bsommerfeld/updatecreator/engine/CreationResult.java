package de.bsommerfeld.updatecreator.engine;

import de.bsommerfeld.updatecreator.engine.classify.ChangeManifest;
import de.bsommerfeld.updatecreator.engine.place.PlacementResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a successful {@code create} run.
 *
 * @param archive    the written update zip
 * @param updateName name of the update
 * @param manifest   added and modified files
 * @param placements one result per top-level entry, directories first
 */
public record CreationResult(Path archive, String updateName, ChangeManifest manifest,
                             List<PlacementResult> placements) {

    public CreationResult {
        placements = List.copyOf(placements);
    }
}
