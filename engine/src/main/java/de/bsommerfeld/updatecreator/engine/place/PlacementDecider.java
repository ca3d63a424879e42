package de.bsommerfeld.updatecreator.engine.place;

import de.bsommerfeld.updatecreator.core.error.CopyException;
import de.bsommerfeld.updatecreator.core.error.InputUnavailableException;
import de.bsommerfeld.updatecreator.core.error.UpdateCreationException;
import de.bsommerfeld.updatecreator.core.event.ApplicationEventBus;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.EntrySkippedEvent;
import de.bsommerfeld.updatecreator.core.util.RelativePaths;
import de.bsommerfeld.updatecreator.engine.classify.ChangeClassifier;
import de.bsommerfeld.updatecreator.engine.classify.ChangeRecord;
import de.bsommerfeld.updatecreator.engine.match.MatchSet;
import de.bsommerfeld.updatecreator.engine.scan.InventoryEntry;
import de.bsommerfeld.updatecreator.engine.scan.UpdateInventory;
import de.bsommerfeld.updatecreator.engine.tree.DistributionTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides where a top-level update entry goes and copies it there.
 *
 * <p>Each call runs one entry through the {@link PlacementState} machine:
 * <ul>
 * <li><strong>single match</strong>: copied to the matched location without asking</li>
 * <li><strong>multiple matches</strong>: the user picks one or more locations, {@code 0} skips</li>
 * <li><strong>no match</strong>: the user may add it as new content at a location of their choice</li>
 * </ul>
 * Invalid answers repeat the current question. Copy failures and a closed input end the run.
 */
public final class PlacementDecider {

    private static final Logger LOG = LoggerFactory.getLogger(PlacementDecider.class);

    private final Prompter prompter;
    private final DistributionTree tree;
    private final UpdateInventory inventory;
    private final ChangeClassifier classifier;
    private final ApplicationEventBus eventBus;

    public PlacementDecider(Prompter prompter, DistributionTree tree, UpdateInventory inventory,
                            ChangeClassifier classifier, ApplicationEventBus eventBus) {
        this.prompter = prompter;
        this.tree = tree;
        this.inventory = inventory;
        this.classifier = classifier;
        this.eventBus = eventBus;
    }

    /**
     * Places the entry the match set was built for.
     *
     * @throws CopyException              if copying into the staging area fails
     * @throws InputUnavailableException  if an answer is needed but the input is gone
     */
    public PlacementResult place(MatchSet matches) throws UpdateCreationException {
        Placement placement = new Placement(matches);
        while (!placement.state.isTerminal()) {
            PlacementState next = switch (placement.state) {
                case SEARCHING -> classify(placement);
                case NO_MATCH -> confirmNewContent(placement);
                case AWAITING_DESTINATION -> readDestination(placement);
                case AWAITING_CONFIRMATION -> confirmDestination(placement);
                case SINGLE_MATCH -> useSingleMatch(placement);
                case MULTIPLE_MATCH -> showMatches(placement);
                case AWAITING_SELECTION -> readSelection(placement);
                case COPYING -> copy(placement);
                case DONE, SKIPPED -> throw new IllegalStateException("Terminal state " + placement.state);
            };
            LOG.debug("[{}] {} -> {}", placement.name, placement.state, next);
            placement.state = next;
        }

        if (placement.state == PlacementState.SKIPPED) {
            LOG.debug("Skipping copying '{}': {}", placement.name, placement.skipReason);
            eventBus.post(new EntrySkippedEvent(placement.name, placement.skipReason));
        }
        return new PlacementResult(placement.name, placement.state, placement.destinations, placement.changes);
    }

    private PlacementState classify(Placement placement) {
        switch (placement.matches.size()) {
            case 0:
                prompter.show("'" + placement.name + "' not found in distribution.");
                return PlacementState.NO_MATCH;
            case 1:
                return PlacementState.SINGLE_MATCH;
            default:
                return PlacementState.MULTIPLE_MATCH;
        }
    }

    private PlacementState confirmNewContent(Placement placement) throws InputUnavailableException {
        Preference preference = Preference.parse(
                prompter.ask("Do you want to add it as a new " + placement.kind() + "? [y/N]: "), Preference.NO);
        switch (preference) {
            case YES:
                return PlacementState.AWAITING_DESTINATION;
            case NO:
                return placement.skip("not found in distribution");
            default:
                prompter.show("Invalid preference. Enter Y for Yes or N for No.");
                return PlacementState.NO_MATCH;
        }
    }

    private PlacementState readDestination(Placement placement) throws InputUnavailableException {
        String destination = RelativePaths.strip(
                prompter.ask("Enter destination directory relative to CARBON_HOME: ").trim());
        if (!RelativePaths.isConfined(destination)) {
            LOG.debug("Rejected destination '{}'", destination);
            prompter.show("Entered path must stay inside CARBON_HOME.");
            return PlacementState.AWAITING_DESTINATION;
        }
        placement.enteredPath = destination;

        String candidate = RelativePaths.join(destination, placement.name);
        if (tree.exists(candidate, placement.matches.isDirectory())) {
            LOG.debug("{} exists in the distribution", candidate);
            placement.destinations.add(destination);
            return PlacementState.COPYING;
        }
        if (!destination.isEmpty()) {
            prompter.show("Entered relative path does not exist in the distribution.");
            return PlacementState.AWAITING_CONFIRMATION;
        }
        placement.destinations.add(destination);
        return PlacementState.COPYING;
    }

    private PlacementState confirmDestination(Placement placement) throws InputUnavailableException {
        Preference preference = Preference.parse(prompter.ask("Copy anyway? [y/n/R]: "), Preference.REENTER);
        switch (preference) {
            case YES:
                placement.destinations.add(placement.enteredPath);
                return PlacementState.COPYING;
            case NO:
                return placement.skip("destination '" + placement.enteredPath + "' declined");
            case REENTER:
                return PlacementState.AWAITING_DESTINATION;
            default:
                prompter.show("Invalid preference. Enter Y for Yes or N for No or R for Re-enter.");
                return PlacementState.AWAITING_CONFIRMATION;
        }
    }

    private PlacementState useSingleMatch(Placement placement) {
        placement.destinations.add(placement.matches.sortedPaths().get(0));
        placement.unambiguous = true;
        return PlacementState.COPYING;
    }

    private PlacementState showMatches(Placement placement) {
        placement.candidates = placement.matches.sortedPaths();
        prompter.show("Multiple matches found for '" + placement.name + "' in the distribution.");
        prompter.show(LocationTable.render(placement.name, placement.candidates));
        return PlacementState.AWAITING_SELECTION;
    }

    private PlacementState readSelection(Placement placement) throws InputUnavailableException {
        String input = prompter.ask(
                "Enter preference(s)[Multiple selections separated by commas, 0 to skip copying]: ");
        Selection selection;
        try {
            selection = Selection.parse(input, placement.candidates.size());
        } catch (InvalidSelectionException e) {
            LOG.debug("Rejected selection '{}': {}", input, e.getMessage());
            prompter.show(e.getMessage());
            return PlacementState.AWAITING_SELECTION;
        }
        if (selection.skip()) {
            prompter.show("0 entered. Skipping copying '" + placement.name + "'.");
            return placement.skip("0 entered");
        }
        for (int index : selection.indices()) {
            placement.destinations.add(placement.candidates.get(index - 1));
        }
        return PlacementState.COPYING;
    }

    private PlacementState copy(Placement placement) throws CopyException {
        for (String destination : placement.destinations) {
            if (placement.matches.isDirectory()) {
                List<InventoryEntry> files = inventory.filesUnder(placement.name);
                LOG.debug("Copying {} files of {} to '{}'", files.size(), placement.name, destination);
                for (InventoryEntry file : files) {
                    copyOne(placement, file, RelativePaths.join(destination, file.path()));
                }
            } else {
                InventoryEntry file = inventory.get(placement.name);
                copyOne(placement, file, RelativePaths.join(destination, placement.name));
            }
        }
        return PlacementState.DONE;
    }

    private void copyOne(Placement placement, InventoryEntry file, String destination) throws CopyException {
        classifier.copy(file, destination, placement.unambiguous).ifPresent(placement.changes::add);
    }

    /**
     * Working state of one entry.
     */
    private static final class Placement {

        private final MatchSet matches;
        private final String name;
        private final List<String> destinations = new ArrayList<>();
        private final List<ChangeRecord> changes = new ArrayList<>();
        private PlacementState state = PlacementState.SEARCHING;
        private List<String> candidates = List.of();
        private String enteredPath = "";
        private String skipReason;
        private boolean unambiguous;

        private Placement(MatchSet matches) {
            this.matches = matches;
            this.name = matches.name();
        }

        private String kind() {
            return matches.isDirectory() ? "directory" : "file";
        }

        private PlacementState skip(String reason) {
            this.skipReason = reason;
            return PlacementState.SKIPPED;
        }
    }
}
