package de.bsommerfeld.updatecreator.core.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of {@code update-descriptor.yaml}: metadata written by the update author plus
 * the file changes filled in while the package is assembled.
 *
 * @param updateNumber    four digit sequence number of the update
 * @param platformVersion kernel version the update targets (e.g. "4.4.0")
 * @param platformName    platform code name
 * @param appliesTo       products the update applies to
 * @param bugFixes        issue id to summary
 * @param description     free text
 * @param fileChanges     files the package adds, removes or modifies
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"update_number", "platform_version", "platform_name", "applies_to",
        "bug_fixes", "description", "file_changes"})
public record UpdateDescriptor(
        @JsonProperty("update_number") String updateNumber,
        @JsonProperty("platform_version") String platformVersion,
        @JsonProperty("platform_name") String platformName,
        @JsonProperty("applies_to") String appliesTo,
        @JsonProperty("bug_fixes") Map<String, String> bugFixes,
        @JsonProperty("description") String description,
        @JsonProperty("file_changes") FileChanges fileChanges) {

    public UpdateDescriptor {
        updateNumber = updateNumber == null ? "" : updateNumber;
        platformVersion = platformVersion == null ? "" : platformVersion;
        platformName = platformName == null ? "" : platformName;
        appliesTo = appliesTo == null ? "" : appliesTo;
        bugFixes = bugFixes == null ? Map.of() : new LinkedHashMap<>(bugFixes);
        description = description == null ? "" : description;
        fileChanges = fileChanges == null ? FileChanges.empty() : fileChanges;
    }

    /**
     * Blank descriptor written by {@code init}.
     */
    public static UpdateDescriptor template() {
        return new UpdateDescriptor(null, null, null, null, null, null, null);
    }

    /**
     * Name of the update package: {@code <prefix>-<platform_version>-<update_number>}.
     */
    public String updateName(String prefix) {
        return prefix + "-" + platformVersion + "-" + updateNumber;
    }

    /**
     * Copy with the added and modified lists replaced. Removed files stay as authored.
     */
    public UpdateDescriptor withChanges(List<String> added, List<String> modified) {
        return new UpdateDescriptor(updateNumber, platformVersion, platformName, appliesTo, bugFixes,
                description, new FileChanges(added, fileChanges.removedFiles(), modified));
    }
}
