package de.bsommerfeld.updatecreator.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RunContextTest {

    private static RunContext context(Set<String> ignored) {
        return new RunContext(Paths.get("update"), Paths.get("wso2am-2.0.0.zip"), "wso2am-2.0.0",
                "WSO2-CARBON-UPDATE-4.4.0-0001", Paths.get("temp", "WSO2-CARBON-UPDATE-4.4.0-0001"),
                "carbon.home", Paths.get("out"), true, ignored);
    }

    @Test
    void carbonHomeDirectory_shouldBeInsideStagingRoot() {
        RunContext context = context(Set.of());
        assertEquals(Paths.get("temp", "WSO2-CARBON-UPDATE-4.4.0-0001", "carbon.home"),
                context.carbonHomeDirectory());
    }

    @Test
    void archive_shouldBeNamedAfterUpdate() {
        Path archive = context(Set.of()).archive();
        assertEquals(Paths.get("out", "WSO2-CARBON-UPDATE-4.4.0-0001.zip"), archive);
    }

    @Test
    void ignoredNames_shouldNotFollowLaterChangesOfTheSource() {
        Set<String> ignored = new HashSet<>(Set.of("README.txt"));
        RunContext context = context(ignored);
        ignored.add("LICENSE.txt");

        assertEquals(Set.of("README.txt"), context.ignoredNames());
        assertThrows(UnsupportedOperationException.class, () -> context.ignoredNames().add("x"));
    }
}
