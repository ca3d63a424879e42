package de.bsommerfeld.updatecreator.engine.tree;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * One entry of the baseline archive as seen by the indexer.
 *
 * @param name      full entry name including the leading distribution folder
 * @param directory whether the entry describes a directory
 * @param content   opens the payload; not consulted for directories
 */
public record ArchiveEntry(String name, boolean directory, Content content) {

    @FunctionalInterface
    public interface Content {
        InputStream open() throws IOException;
    }

    public static ArchiveEntry directory(String name) {
        return new ArchiveEntry(name, true, () -> InputStream.nullInputStream());
    }

    public static ArchiveEntry file(String name, byte[] payload) {
        return new ArchiveEntry(name, false, () -> new ByteArrayInputStream(payload));
    }
}
