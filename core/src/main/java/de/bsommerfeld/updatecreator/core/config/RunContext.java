package de.bsommerfeld.updatecreator.core.config;

import java.nio.file.Path;
import java.util.Set;

/**
 * Everything one {@code create} run needs to know about its inputs and outputs.
 * Created once at the start of the run and handed to every component.
 *
 * @param updateRoot       directory holding the changed files and the descriptor
 * @param distribution     baseline distribution zip
 * @param productName      distribution zip name without {@code .zip}
 * @param updateName       name of the update package, also its root folder
 * @param stagingRoot      staging directory of this update ({@code <staging>/<updateName>})
 * @param carbonHome       directory inside the staging root that mirrors the distribution root
 * @param outputDirectory  where the finished zip is written
 * @param checkHash        whether unchanged files are left out on single matches
 * @param ignoredNames     names the scanner skips together with their subtree
 */
public record RunContext(
        Path updateRoot,
        Path distribution,
        String productName,
        String updateName,
        Path stagingRoot,
        String carbonHome,
        Path outputDirectory,
        boolean checkHash,
        Set<String> ignoredNames) {

    public RunContext {
        ignoredNames = Set.copyOf(ignoredNames);
    }

    public Path carbonHomeDirectory() {
        return stagingRoot.resolve(carbonHome);
    }

    public Path archive() {
        return outputDirectory.resolve(updateName + ".zip");
    }
}
