package de.bsommerfeld.updatecreator.engine.stage;

import de.bsommerfeld.updatecreator.core.config.RunContext;
import de.bsommerfeld.updatecreator.core.error.CopyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StagingAreaTest {

    @TempDir
    Path tempDir;

    private Path updateRoot;
    private RunContext context;
    private StagingArea staging;

    @BeforeEach
    void setUp() throws Exception {
        updateRoot = tempDir.resolve("update");
        Files.createDirectories(updateRoot.resolve("conf"));
        Files.writeString(updateRoot.resolve("conf/carbon.xml"), "<Server/>");
        Files.writeString(updateRoot.resolve("update-descriptor.yaml"), "update_number: 0001");
        Files.writeString(updateRoot.resolve("README.txt"), "readme");
        context = new RunContext(updateRoot, tempDir.resolve("dist.zip"), "dist", "UPDATE-1",
                tempDir.resolve("temp/UPDATE-1"), "carbon.home", tempDir, true, Set.of());
        staging = new StagingArea(context);
    }

    @Test
    void prepare_shouldCreateCarbonHome() throws Exception {
        staging.prepare();

        assertTrue(Files.isDirectory(context.carbonHomeDirectory()));
        assertEquals(context.stagingRoot(), staging.root());
    }

    @Test
    void prepare_shouldRemoveLeftoversOfEarlierRun() throws Exception {
        Path leftover = context.carbonHomeDirectory().resolve("old/stale.txt");
        Files.createDirectories(leftover.getParent());
        Files.writeString(leftover, "stale");

        staging.prepare();

        assertFalse(Files.exists(leftover));
        assertTrue(Files.isDirectory(context.carbonHomeDirectory()));
    }

    @Test
    void copy_shouldCreateParentDirectories() throws Exception {
        staging.prepare();

        staging.copy("conf/carbon.xml", "repository/conf/carbon.xml");

        assertEquals("<Server/>",
                Files.readString(context.carbonHomeDirectory().resolve("repository/conf/carbon.xml")));
    }

    @Test
    void copy_shouldFailForMissingSource() throws Exception {
        staging.prepare();

        assertThrows(CopyException.class, () -> staging.copy("conf/missing.xml", "missing.xml"));
    }

    @Test
    void copy_shouldRejectDestinationOutsideCarbonHome() throws Exception {
        staging.prepare();

        assertThrows(CopyException.class, () -> staging.copy("conf/carbon.xml", "../../../carbon.xml"));
        assertFalse(Files.exists(tempDir.resolve("carbon.xml")));
    }

    @Test
    void copyResourceFiles_shouldReportMissingOptionalFiles() throws Exception {
        staging.prepare();

        List<String> missing = staging.copyResourceFiles(List.of("update-descriptor.yaml"),
                List.of("README.txt", "LICENSE.txt"));

        assertEquals(List.of("LICENSE.txt"), missing);
        assertTrue(Files.exists(context.stagingRoot().resolve("README.txt")));
        assertTrue(Files.exists(context.stagingRoot().resolve("update-descriptor.yaml")));
    }

    @Test
    void copyResourceFiles_shouldFailForMissingMandatoryFile() throws Exception {
        staging.prepare();

        CopyException e = assertThrows(CopyException.class,
                () -> staging.copyResourceFiles(List.of("instructions.txt"), List.of()));
        assertTrue(e.getMessage().contains("instructions.txt"));
    }

    @Test
    void discard_shouldRemoveStagingAndEmptyParent() throws Exception {
        staging.prepare();
        staging.copy("conf/carbon.xml", "repository/conf/carbon.xml");

        staging.discard();

        assertFalse(Files.exists(context.stagingRoot()));
        assertFalse(Files.exists(tempDir.resolve("temp")));
    }

    @Test
    void discard_shouldKeepParentWithOtherContent() throws Exception {
        staging.prepare();
        Files.writeString(tempDir.resolve("temp/other.txt"), "other");

        staging.discard();

        assertFalse(Files.exists(context.stagingRoot()));
        assertTrue(Files.exists(tempDir.resolve("temp/other.txt")));
    }

    @Test
    void discard_shouldKeepParentThatExistedBefore() throws Exception {
        Files.createDirectories(tempDir.resolve("temp"));
        staging.prepare();

        staging.discard();

        assertFalse(Files.exists(context.stagingRoot()));
        assertTrue(Files.isDirectory(tempDir.resolve("temp")));
    }

    @Test
    void discard_shouldToleratePreparedNothing() {
        assertDoesNotThrow(() -> staging.discard());
    }
}
