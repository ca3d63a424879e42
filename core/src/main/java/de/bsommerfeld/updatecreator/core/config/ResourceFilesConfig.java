package de.bsommerfeld.updatecreator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Files in the update directory that describe the update rather than belong to the
 * distribution. None of them is ever matched against the distribution.
 */
public class ResourceFilesConfig {

    public static final String UPDATE_DESCRIPTOR_FILE = "update-descriptor.yaml";

    @JsonProperty("mandatory")
    private List<String> mandatory = new ArrayList<>(List.of(UPDATE_DESCRIPTOR_FILE));

    @JsonProperty("optional")
    private List<String> optional = new ArrayList<>(List.of(
            "README.txt", "LICENSE.txt", "NOT_A_CONTRIBUTION.txt", "instructions.txt"));

    /** Names that are neither scanned nor copied into the package. */
    @JsonProperty("skip")
    private List<String> skip = new ArrayList<>();

    public List<String> getMandatory() {
        return mandatory;
    }

    public void setMandatory(List<String> mandatory) {
        this.mandatory = mandatory;
    }

    public List<String> getOptional() {
        return optional;
    }

    public void setOptional(List<String> optional) {
        this.optional = optional;
    }

    public List<String> getSkip() {
        return skip;
    }

    public void setSkip(List<String> skip) {
        this.skip = skip;
    }

    /**
     * Every name the directory scanner has to leave out.
     */
    @JsonIgnore
    public Set<String> ignoredNames() {
        Set<String> names = new LinkedHashSet<>(mandatory);
        names.addAll(optional);
        names.addAll(skip);
        return names;
    }
}
