package de.bsommerfeld.updatecreator.engine;

import de.bsommerfeld.updatecreator.core.config.CreatorConfig;
import de.bsommerfeld.updatecreator.core.config.ResourceFilesConfig;
import de.bsommerfeld.updatecreator.core.config.RunContext;
import de.bsommerfeld.updatecreator.core.descriptor.UpdateDescriptor;
import de.bsommerfeld.updatecreator.core.descriptor.UpdateDescriptorIO;
import de.bsommerfeld.updatecreator.core.error.UpdateCreationException;
import de.bsommerfeld.updatecreator.core.event.ApplicationEventBus;
import de.bsommerfeld.updatecreator.core.event.PlacementEvents.ResourceFileMissingEvent;
import de.bsommerfeld.updatecreator.engine.classify.ChangeClassifier;
import de.bsommerfeld.updatecreator.engine.classify.ChangeManifest;
import de.bsommerfeld.updatecreator.engine.match.MatchResolver;
import de.bsommerfeld.updatecreator.engine.place.PlacementDecider;
import de.bsommerfeld.updatecreator.engine.place.PlacementResult;
import de.bsommerfeld.updatecreator.engine.place.Prompter;
import de.bsommerfeld.updatecreator.engine.scan.DirectoryScanner;
import de.bsommerfeld.updatecreator.engine.scan.UpdateInventory;
import de.bsommerfeld.updatecreator.engine.stage.StagingArea;
import de.bsommerfeld.updatecreator.engine.stage.UpdateArchiver;
import de.bsommerfeld.updatecreator.engine.tree.DistributionIndexer;
import de.bsommerfeld.updatecreator.engine.tree.DistributionTree;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates an update zip from an update directory and the distribution it applies to.
 *
 * <p>Workflow: check inputs → read descriptor → scan update → index distribution →
 * place every top-level directory, then every top-level file → copy resource files →
 * write descriptor with file changes → zip → remove staging directory.
 */
public final class UpdateCreator {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateCreator.class);

    private final CreatorConfig config;
    private final UpdateDescriptorIO descriptorIO;
    private final DirectoryScanner scanner;
    private final DistributionIndexer indexer;
    private final MatchResolver resolver;
    private final UpdateArchiver archiver;
    private final Prompter prompter;
    private final ApplicationEventBus eventBus;

    @Inject
    public UpdateCreator(CreatorConfig config, UpdateDescriptorIO descriptorIO, DirectoryScanner scanner,
                         DistributionIndexer indexer, MatchResolver resolver, UpdateArchiver archiver,
                         Prompter prompter, ApplicationEventBus eventBus) {
        this.config = config;
        this.descriptorIO = descriptorIO;
        this.scanner = scanner;
        this.indexer = indexer;
        this.resolver = resolver;
        this.archiver = archiver;
        this.prompter = prompter;
        this.eventBus = eventBus;
    }

    /**
     * Runs a full {@code create}.
     *
     * @param updateDirectory directory with the changed files and {@code update-descriptor.yaml}
     * @param distribution    zip of the distribution the update applies to
     * @param checkHash       leave out files whose content equals the distribution's on single matches
     * @throws UpdateCreationException on the first unrecoverable error; no archive is written
     */
    public CreationResult create(Path updateDirectory, Path distribution, boolean checkHash)
            throws UpdateCreationException {
        LOG.debug("[create] {} {}", updateDirectory, distribution);
        Path updateRoot = updateDirectory.normalize();
        if (!Files.isDirectory(updateRoot)) {
            throw new UpdateCreationException("Update directory (" + updateDirectory + ") does not exist.");
        }
        UpdateDescriptor descriptor = descriptorIO.load(updateRoot);
        descriptorIO.validate(descriptor);

        if (!Files.isRegularFile(distribution)) {
            throw new UpdateCreationException("Distribution does not exist at '" + distribution + "'");
        }
        String zipName = distribution.getFileName().toString();
        if (!zipName.endsWith(".zip")) {
            throw new UpdateCreationException("Entered distribution path (" + distribution
                    + ") does not point to a zip file.");
        }

        RunContext context = new RunContext(
                updateRoot,
                distribution,
                zipName.substring(0, zipName.length() - ".zip".length()),
                descriptor.updateName(config.getUpdateNamePrefix()),
                Paths.get(config.getStagingDirectory()).resolve(descriptor.updateName(config.getUpdateNamePrefix())),
                config.getCarbonHome(),
                Paths.get(config.getOutputDirectory()),
                checkHash,
                config.getResourceFiles().ignoredNames());
        return run(context, descriptor);
    }

    private CreationResult run(RunContext context, UpdateDescriptor descriptor) throws UpdateCreationException {
        UpdateInventory inventory = scanner.scan(context.updateRoot(), context.ignoredNames());

        prompter.show("Reading " + context.productName() + ". Please wait...");
        DistributionTree tree = indexer.index(context.distribution());

        StagingArea staging = new StagingArea(context);
        ChangeManifest manifest = new ChangeManifest();
        try {
            staging.prepare();
            ChangeClassifier classifier = new ChangeClassifier(tree, staging, manifest, eventBus, context.checkHash());
            PlacementDecider decider = new PlacementDecider(prompter, tree, inventory, classifier, eventBus);

            List<PlacementResult> placements = new ArrayList<>();
            for (String directory : inventory.rootDirectoryNames()) {
                placements.add(decider.place(resolver.findMatches(tree, directory, true)));
            }
            for (String file : inventory.rootFileNames()) {
                placements.add(decider.place(resolver.findMatches(tree, file, false)));
            }

            ResourceFilesConfig resources = config.getResourceFiles();
            for (String missing : staging.copyResourceFiles(resources.getMandatory(), resources.getOptional())) {
                eventBus.post(new ResourceFileMissingEvent(missing));
            }
            descriptorIO.write(staging.root().resolve(ResourceFilesConfig.UPDATE_DESCRIPTOR_FILE),
                    descriptor.withChanges(manifest.added(), manifest.modified()));

            Path archive = archiver.zip(staging.root(), context.archive());
            LOG.info("Created {} with {} added and {} modified files",
                    archive, manifest.added().size(), manifest.modified().size());
            return new CreationResult(archive, context.updateName(), manifest, placements);
        } finally {
            staging.discard();
        }
    }
}
