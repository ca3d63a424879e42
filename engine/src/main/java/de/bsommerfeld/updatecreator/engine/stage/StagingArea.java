package de.bsommerfeld.updatecreator.engine.stage;

import de.bsommerfeld.updatecreator.core.config.RunContext;
import de.bsommerfeld.updatecreator.core.error.CopyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * The directory an update package is assembled in before it is zipped.
 *
 * <pre>
 * {stagingRoot}/
 *   update-descriptor.yaml, README.txt, ...
 *   {carbonHome}/           mirrors the distribution root
 * </pre>
 */
public final class StagingArea {

    private static final Logger LOG = LoggerFactory.getLogger(StagingArea.class);

    private final RunContext context;
    private boolean createdParent;

    public StagingArea(RunContext context) {
        this.context = context;
    }

    public Path root() {
        return context.stagingRoot();
    }

    /**
     * Removes leftovers of an earlier run for the same update and creates the carbon home.
     */
    public void prepare() throws CopyException {
        try {
            deleteRecursively(context.stagingRoot());
            Path parent = context.stagingRoot().getParent();
            createdParent = parent != null && !Files.exists(parent);
            Files.createDirectories(context.carbonHomeDirectory());
        } catch (IOException e) {
            throw new CopyException("Cannot prepare staging directory '" + context.stagingRoot() + "'", e);
        }
    }

    /**
     * Copies a file of the update directory to a path below the carbon home. Parent
     * directories are created as needed.
     *
     * @param sourceRelative      path relative to the update root
     * @param destinationRelative path relative to the distribution root
     * @throws CopyException if the destination lies outside the carbon home or the copy fails
     */
    public void copy(String sourceRelative, String destinationRelative) throws CopyException {
        Path source = context.updateRoot().resolve(sourceRelative);
        Path carbonHome = context.carbonHomeDirectory().normalize();
        Path target = carbonHome.resolve(destinationRelative).normalize();
        if (!target.startsWith(carbonHome) || target.equals(carbonHome)) {
            throw new CopyException("Destination '" + destinationRelative + "' is outside of " + carbonHome);
        }
        LOG.debug("[Copy] {} -> {}", source, target);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new CopyException("Failed to copy '" + source + "' to '" + target + "'", e);
        }
    }

    /**
     * Copies the descriptive files of the update into the staging root.
     *
     * @return names of optional files that were not present
     * @throws CopyException if a mandatory file is missing or any copy fails
     */
    public List<String> copyResourceFiles(List<String> mandatory, List<String> optional) throws CopyException {
        List<String> missing = new ArrayList<>();
        for (String name : mandatory) {
            if (!copyResource(name)) {
                throw new CopyException("Mandatory resource file '" + name + "' not found in '"
                        + context.updateRoot() + "'");
            }
        }
        for (String name : optional) {
            if (!copyResource(name)) {
                LOG.info("Optional resource file '{}' not found", name);
                missing.add(name);
            }
        }
        return missing;
    }

    /**
     * Deletes the staging directory of this run, and its parent if {@link #prepare()} created
     * it and nothing else was put there. Failures are logged; a leftover staging directory is
     * cleared again by the next {@link #prepare()}.
     */
    public void discard() {
        try {
            deleteRecursively(context.stagingRoot());
            Path parent = context.stagingRoot().getParent();
            if (createdParent && isEmptyDirectory(parent)) {
                Files.delete(parent);
            }
        } catch (IOException e) {
            LOG.warn("Could not remove staging directory '{}': {}", context.stagingRoot(), e.getMessage());
        }
    }

    private boolean copyResource(String name) throws CopyException {
        Path source = context.updateRoot().resolve(name);
        if (!Files.isRegularFile(source)) {
            return false;
        }
        Path target = context.stagingRoot().resolve(name);
        try {
            Files.createDirectories(context.stagingRoot());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            throw new CopyException("Failed to copy resource file '" + source + "'", e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return false;
        try (var entries = Files.list(dir)) {
            return entries.findFirst().isEmpty();
        }
    }
}
