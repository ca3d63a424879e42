package de.bsommerfeld.updatecreator.engine.place;

import de.bsommerfeld.updatecreator.engine.classify.ChangeRecord;

import java.util.List;

/**
 * Outcome of placing one top-level entry.
 *
 * @param name         the top-level entry
 * @param state        {@link PlacementState#DONE} or {@link PlacementState#SKIPPED}
 * @param destinations chosen parent locations, relative to the distribution root
 * @param changes      files copied into the package
 */
public record PlacementResult(String name, PlacementState state, List<String> destinations,
                              List<ChangeRecord> changes) {

    public PlacementResult {
        destinations = List.copyOf(destinations);
        changes = List.copyOf(changes);
    }

    public boolean isSkipped() {
        return state == PlacementState.SKIPPED;
    }
}
