package de.bsommerfeld.updatecreator.engine.stage;

import de.bsommerfeld.updatecreator.core.error.CopyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zips a staging directory. The directory itself becomes the single top-level folder of
 * the archive.
 */
public final class UpdateArchiver {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateArchiver.class);

    /**
     * Writes the archive next to {@code zipFile} first and moves it into place once it is
     * complete. On failure no file is left at {@code zipFile}.
     */
    public Path zip(Path sourceDirectory, Path zipFile) throws CopyException {
        String rootName = sourceDirectory.getFileName().toString();
        Path partial = null;
        try {
            Path parent = zipFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            List<Path> paths;
            try (Stream<Path> walk = Files.walk(sourceDirectory)) {
                paths = walk.sorted().collect(Collectors.toList());
            }
            partial = Files.createTempFile(parent, zipFile.getFileName().toString(), ".part");
            try (OutputStream out = Files.newOutputStream(partial);
                 ZipOutputStream zip = new ZipOutputStream(out)) {
                for (Path path : paths) {
                    String relative = sourceDirectory.relativize(path).toString().replace('\\', '/');
                    String name = relative.isEmpty() ? rootName : rootName + "/" + relative;
                    if (Files.isDirectory(path)) {
                        zip.putNextEntry(new ZipEntry(name + "/"));
                        zip.closeEntry();
                    } else {
                        zip.putNextEntry(new ZipEntry(name));
                        Files.copy(path, zip);
                        zip.closeEntry();
                    }
                }
            }
            moveIntoPlace(partial, zipFile);
            LOG.debug("Wrote {} entries to {}", paths.size(), zipFile);
            return zipFile;
        } catch (IOException e) {
            CopyException failure = new CopyException("Failed to create '" + zipFile + "'", e);
            if (partial != null) {
                try {
                    Files.deleteIfExists(partial);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    private static void moveIntoPlace(Path partial, Path zipFile) throws IOException {
        try {
            Files.move(partial, zipFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, replacing it", zipFile);
            Files.move(partial, zipFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
