package de.bsommerfeld.updatecreator.engine.place;

import de.bsommerfeld.updatecreator.core.config.RunContext;
import de.bsommerfeld.updatecreator.core.error.InputUnavailableException;
import de.bsommerfeld.updatecreator.core.error.UpdateCreationException;
import de.bsommerfeld.updatecreator.core.event.ApplicationEventBus;
import de.bsommerfeld.updatecreator.engine.classify.ChangeClassifier;
import de.bsommerfeld.updatecreator.engine.classify.ChangeManifest;
import de.bsommerfeld.updatecreator.engine.classify.ChangeRecord;
import de.bsommerfeld.updatecreator.engine.classify.ChangeType;
import de.bsommerfeld.updatecreator.engine.match.MatchResolver;
import de.bsommerfeld.updatecreator.engine.scan.DirectoryScanner;
import de.bsommerfeld.updatecreator.engine.scan.UpdateInventory;
import de.bsommerfeld.updatecreator.engine.stage.StagingArea;
import de.bsommerfeld.updatecreator.engine.tree.ArchiveEntry;
import de.bsommerfeld.updatecreator.engine.tree.DistributionIndexer;
import de.bsommerfeld.updatecreator.engine.tree.DistributionTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

/**
 * Drives the placement state machine against a small distribution with a mocked prompter.
 */
class PlacementDeciderTest {

    @TempDir
    Path tempDir;

    private Path updateRoot;
    private RunContext context;
    private DistributionTree tree;
    private ChangeManifest manifest;
    private Prompter prompter;
    private final MatchResolver resolver = new MatchResolver();

    private static ArchiveEntry file(String path, String content) {
        return ArchiveEntry.file("wso2am-2.0.0/" + path, content.getBytes(StandardCharsets.UTF_8));
    }

    @BeforeEach
    void setUp() throws Exception {
        updateRoot = tempDir.resolve("update");
        Files.createDirectories(updateRoot);
        context = new RunContext(updateRoot, tempDir.resolve("wso2am-2.0.0.zip"), "wso2am-2.0.0",
                "WSO2-CARBON-UPDATE-4.4.0-0001", tempDir.resolve("temp/WSO2-CARBON-UPDATE-4.4.0-0001"),
                "carbon.home", tempDir, true, Set.of("update-descriptor.yaml"));
        tree = new DistributionIndexer().index(List.of(
                file("repository/conf/carbon.xml", "<Server/>"),
                file("repository/conf/axis2/axis2.xml", "<axisconfig/>"),
                file("repository/conf/a/logging-config.xml", "<logging/>"),
                file("repository/conf/b/logging-config.xml", "<logging/>"),
                ArchiveEntry.directory("wso2am-2.0.0/repository/components/lib/")));
        manifest = new ChangeManifest();
        prompter = mock(Prompter.class);
    }

    private void write(String relative, String content) throws IOException {
        Path target = updateRoot.resolve(relative);
        Files.createDirectories(target.getParent());
        Files.writeString(target, content);
    }

    private PlacementResult place(String name, boolean directory) throws Exception {
        UpdateInventory inventory = new DirectoryScanner().scan(updateRoot, context.ignoredNames());
        StagingArea staging = new StagingArea(context);
        staging.prepare();
        ChangeClassifier classifier = new ChangeClassifier(tree, staging, manifest, new ApplicationEventBus(),
                context.checkHash());
        PlacementDecider decider = new PlacementDecider(prompter, tree, inventory, classifier,
                new ApplicationEventBus());
        return decider.place(resolver.findMatches(tree, name, directory));
    }

    private Path staged(String relative) {
        return context.carbonHomeDirectory().resolve(relative);
    }

    // -- single match --

    @Test
    void singleMatch_shouldCopyWholeDirectoryWithoutPrompting() throws Exception {
        write("conf/carbon.xml", "<Server changed/>");
        write("conf/axis2/axis2.xml", "<axisconfig changed/>");
        write("conf/new.xml", "<new/>");

        PlacementResult result = place("conf", true);

        assertEquals(PlacementState.DONE, result.state());
        assertEquals(List.of("repository"), result.destinations());
        assertTrue(Files.exists(staged("repository/conf/carbon.xml")));
        assertTrue(Files.exists(staged("repository/conf/axis2/axis2.xml")));
        assertTrue(Files.exists(staged("repository/conf/new.xml")));
        assertEquals(List.of("repository/conf/new.xml"), manifest.added());
        assertEquals(List.of("repository/conf/axis2/axis2.xml", "repository/conf/carbon.xml"), manifest.modified());
        verifyNoInteractions(prompter);
    }

    @Test
    void singleMatch_shouldLeaveOutFilesWithIdenticalContent() throws Exception {
        write("conf/carbon.xml", "<Server/>");
        write("conf/axis2/axis2.xml", "<axisconfig changed/>");

        PlacementResult result = place("conf", true);

        assertFalse(Files.exists(staged("repository/conf/carbon.xml")));
        assertEquals(List.of(new ChangeRecord("repository/conf/axis2/axis2.xml", ChangeType.MODIFIED)),
                result.changes());
    }

    // -- multiple matches --

    @Test
    void multipleMatches_shouldCopyToEverySelectedLocation() throws Exception {
        write("logging-config.xml", "<logging level=\"debug\"/>");
        when(prompter.ask(anyString())).thenReturn("1,2");

        PlacementResult result = place("logging-config.xml", false);

        assertEquals(PlacementState.DONE, result.state());
        assertEquals(List.of("repository/conf/a/logging-config.xml", "repository/conf/b/logging-config.xml"),
                manifest.modified());
        assertTrue(Files.exists(staged("repository/conf/a/logging-config.xml")));
        assertTrue(Files.exists(staged("repository/conf/b/logging-config.xml")));
    }

    @Test
    void multipleMatches_shouldSkipOnZero() throws Exception {
        write("logging-config.xml", "<logging level=\"debug\"/>");
        when(prompter.ask(anyString())).thenReturn("0");

        PlacementResult result = place("logging-config.xml", false);

        assertTrue(result.isSkipped());
        assertTrue(result.changes().isEmpty());
        assertTrue(manifest.isEmpty());
        assertFalse(Files.exists(staged("repository")));
    }

    @Test
    void multipleMatches_shouldAskAgainForOutOfRangeSelection() throws Exception {
        write("logging-config.xml", "<logging level=\"debug\"/>");
        when(prompter.ask(anyString())).thenReturn("3", "2");

        PlacementResult result = place("logging-config.xml", false);

        verify(prompter, times(2)).ask(contains("Enter preference(s)"));
        verify(prompter).show(contains("0 <= index <= 2"));
        assertEquals(List.of("repository/conf/b"), result.destinations());
        assertEquals(1, manifest.size());
    }

    @Test
    void multipleMatches_shouldCopyEvenIfContentIsIdentical() throws Exception {
        write("logging-config.xml", "<logging/>");
        when(prompter.ask(anyString())).thenReturn("1");

        place("logging-config.xml", false);

        assertEquals(List.of("repository/conf/a/logging-config.xml"), manifest.modified());
    }

    @Test
    void multipleMatches_shouldShowSortedLocationTable() throws Exception {
        write("logging-config.xml", "<logging level=\"debug\"/>");
        when(prompter.ask(anyString())).thenReturn("0");

        place("logging-config.xml", false);

        verify(prompter).show(contains("| 1     | CARBON_HOME/repository/conf/a/logging-config.xml"));
    }

    // -- no match --

    @Test
    void noMatch_shouldSkipOnEmptyAnswer() throws Exception {
        write("foo.jar", "foo");
        when(prompter.ask(anyString())).thenReturn("");

        PlacementResult result = place("foo.jar", false);

        assertTrue(result.isSkipped());
        assertTrue(manifest.isEmpty());
    }

    @Test
    void noMatch_shouldAskAgainForUnknownAnswer() throws Exception {
        write("foo.jar", "foo");
        when(prompter.ask(anyString())).thenReturn("maybe", "n");

        PlacementResult result = place("foo.jar", false);

        assertTrue(result.isSkipped());
        verify(prompter).show("Invalid preference. Enter Y for Yes or N for No.");
    }

    @Test
    void noMatch_shouldCopyToConfirmedNewLocation() throws Exception {
        write("foo.jar", "foo");
        when(prompter.ask(anyString())).thenReturn("y", "/repository/components/lib/", "y");

        PlacementResult result = place("foo.jar", false);

        assertEquals(PlacementState.DONE, result.state());
        assertEquals(List.of("repository/components/lib/foo.jar"), manifest.added());
        assertTrue(Files.exists(staged("repository/components/lib/foo.jar")));
    }

    @Test
    void noMatch_shouldAskAgainForDestinationOutsideCarbonHome() throws Exception {
        write("foo.jar", "foo");
        when(prompter.ask(anyString())).thenReturn("y", "../../../outside", "repository/components/lib", "y");

        PlacementResult result = place("foo.jar", false);

        verify(prompter).show("Entered path must stay inside CARBON_HOME.");
        verify(prompter, times(2)).ask(contains("Enter destination directory"));
        assertEquals(PlacementState.DONE, result.state());
        assertEquals(List.of("repository/components/lib/foo.jar"), manifest.added());
        assertFalse(Files.exists(tempDir.resolve("outside")));
    }

    @Test
    void noMatch_shouldSkipWhenNewLocationIsDeclined() throws Exception {
        write("foo.jar", "foo");
        when(prompter.ask(anyString())).thenReturn("y", "repository/components/dropins", "n");

        PlacementResult result = place("foo.jar", false);

        assertTrue(result.isSkipped());
        assertTrue(manifest.isEmpty());
    }

    @Test
    void noMatch_shouldReenterDestinationOnEmptyConfirmation() throws Exception {
        write("foo.jar", "foo");
        when(prompter.ask(anyString())).thenReturn("y", "typo/path", "", "");

        PlacementResult result = place("foo.jar", false);

        verify(prompter, times(2)).ask(contains("Enter destination directory"));
        assertEquals(List.of(""), result.destinations());
        assertEquals(List.of("foo.jar"), manifest.added());
    }

    @Test
    void noMatch_shouldCopyDirectoryToRootWithoutConfirmation() throws Exception {
        write("newdir/a.txt", "a");
        write("newdir/sub/b.txt", "b");
        when(prompter.ask(anyString())).thenReturn("y", "");

        PlacementResult result = place("newdir", true);

        assertEquals(PlacementState.DONE, result.state());
        assertEquals(List.of("newdir/a.txt", "newdir/sub/b.txt"), manifest.added());
        verify(prompter, never()).ask(contains("Copy anyway"));
    }

    @Test
    void noMatch_shouldFailWhenInputIsClosed() throws Exception {
        write("foo.jar", "foo");
        when(prompter.ask(anyString())).thenThrow(new InputUnavailableException("closed"));

        assertThrows(InputUnavailableException.class, () -> place("foo.jar", false));
    }

    @Test
    void copyFailure_shouldEndPlacement() throws Exception {
        write("conf/new.xml", "<new/>");
        // a regular file where the staging directory has to go
        Files.createDirectories(context.carbonHomeDirectory());
        Files.writeString(context.carbonHomeDirectory().resolve("repository"), "blocker");

        UpdateInventory inventory = new DirectoryScanner().scan(updateRoot, context.ignoredNames());
        ChangeClassifier classifier = new ChangeClassifier(tree, new StagingArea(context), manifest,
                new ApplicationEventBus(), true);
        PlacementDecider decider = new PlacementDecider(prompter, tree, inventory, classifier,
                new ApplicationEventBus());

        assertThrows(UpdateCreationException.class,
                () -> decider.place(resolver.findMatches(tree, "conf", true)));
    }
}
