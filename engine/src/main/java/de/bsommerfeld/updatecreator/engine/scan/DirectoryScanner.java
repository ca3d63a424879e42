package de.bsommerfeld.updatecreator.engine.scan;

import de.bsommerfeld.updatecreator.core.error.ReadException;
import de.bsommerfeld.updatecreator.core.hash.HashUtil;
import de.bsommerfeld.updatecreator.core.util.RelativePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Walks the update directory and hashes every file in it.
 */
public final class DirectoryScanner {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryScanner.class);

    /**
     * Scans everything below {@code root}. Entries whose name is in {@code ignoredNames}
     * are skipped together with their subtree.
     *
     * @throws ReadException if any directory or file cannot be read
     */
    public UpdateInventory scan(Path root, Set<String> ignoredNames) throws ReadException {
        if (!Files.isDirectory(root)) {
            throw new ReadException("Update directory (" + root + ") does not exist.");
        }
        TreeMap<String, InventoryEntry> entries = new TreeMap<>();
        TreeSet<String> rootDirectories = new TreeSet<>();
        TreeSet<String> rootFiles = new TreeSet<>();

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (ignoredNames.contains(dir.getFileName().toString())) {
                        LOG.trace("Ignoring directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    String relative = RelativePaths.of(root, dir);
                    entries.put(relative, new InventoryEntry(relative, true, null));
                    if (dir.getParent().equals(root)) {
                        rootDirectories.add(relative);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    if (ignoredNames.contains(file.getFileName().toString())) {
                        LOG.trace("Ignoring file {}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    String relative = RelativePaths.of(root, file);
                    String sha256 = HashUtil.sha256(file);
                    LOG.trace("{} = {}", relative, sha256);
                    entries.put(relative, new InventoryEntry(relative, false, sha256));
                    if (file.getParent().equals(root)) {
                        rootFiles.add(relative);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    throw exc;
                }
            });
        } catch (IOException | UncheckedIOException e) {
            throw new ReadException("Error occurred while reading the update directory '" + root + "'", e);
        }

        LOG.debug("Scanned {} entries; root directories {}, root files {}",
                entries.size(), rootDirectories, rootFiles);
        return new UpdateInventory(entries, rootDirectories, rootFiles);
    }
}
