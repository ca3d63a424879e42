package de.bsommerfeld.updatecreator.core.descriptor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The {@code file_changes} section of an update descriptor. Paths are relative to the
 * distribution root.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileChanges(
        @JsonProperty("added_files") List<String> addedFiles,
        @JsonProperty("removed_files") List<String> removedFiles,
        @JsonProperty("modified_files") List<String> modifiedFiles) {

    public FileChanges {
        addedFiles = addedFiles == null ? List.of() : List.copyOf(addedFiles);
        removedFiles = removedFiles == null ? List.of() : List.copyOf(removedFiles);
        modifiedFiles = modifiedFiles == null ? List.of() : List.copyOf(modifiedFiles);
    }

    public static FileChanges empty() {
        return new FileChanges(List.of(), List.of(), List.of());
    }
}
