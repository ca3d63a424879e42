package de.bsommerfeld.updatecreator.engine.tree;

import de.bsommerfeld.updatecreator.core.error.ReadException;
import de.bsommerfeld.updatecreator.core.hash.HashUtil;
import de.bsommerfeld.updatecreator.core.util.RelativePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Builds a {@link DistributionTree} from the entries of a distribution archive.
 *
 * <p>Every entry name starts with the distribution folder (e.g. {@code wso2am-2.0.0/}),
 * which is dropped. Missing parent directories are created as placeholders; an explicit
 * entry for the same path later replaces the placeholder's kind and hash.
 */
public final class DistributionIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(DistributionIndexer.class);

    /**
     * Indexes the zip at {@code distribution}.
     *
     * @throws ReadException if the archive or any entry cannot be read
     */
    public DistributionTree index(Path distribution) throws ReadException {
        LOG.debug("Reading zip {}", distribution);
        try (ZipFile zip = new ZipFile(distribution.toFile())) {
            List<ArchiveEntry> entries = new ArrayList<>();
            Enumeration<? extends ZipEntry> zipEntries = zip.entries();
            while (zipEntries.hasMoreElements()) {
                ZipEntry entry = zipEntries.nextElement();
                entries.add(new ArchiveEntry(entry.getName(), entry.isDirectory(),
                        () -> zip.getInputStream(entry)));
            }
            DistributionTree tree = index(entries);
            LOG.debug("Reading zip finished, {} entries", entries.size());
            return tree;
        } catch (IOException e) {
            throw new ReadException("Error occurred while reading '" + distribution + "'", e);
        }
    }

    /**
     * Indexes the given entries. Either every entry is indexed or a {@link ReadException}
     * is thrown and no tree is returned.
     */
    public DistributionTree index(Iterable<ArchiveEntry> entries) throws ReadException {
        Node root = Node.root();
        for (ArchiveEntry entry : entries) {
            List<String> segments = RelativePaths.segments(entry.name());
            if (segments.size() < 2) {
                // the distribution folder itself
                continue;
            }
            List<String> relative = segments.subList(1, segments.size());
            String sha256 = entry.directory() ? null : hash(entry);

            Node current = root;
            for (String segment : relative) {
                current = current.childOrPlaceholder(segment);
            }
            current.declare(entry.directory(), sha256);
            LOG.trace("Indexed {}", current);
        }
        return new DistributionTree(root);
    }

    private static String hash(ArchiveEntry entry) throws ReadException {
        try (InputStream in = entry.content().open()) {
            return HashUtil.sha256(in);
        } catch (IOException e) {
            throw new ReadException("Cannot read '" + entry.name() + "' from the distribution", e);
        }
    }
}
