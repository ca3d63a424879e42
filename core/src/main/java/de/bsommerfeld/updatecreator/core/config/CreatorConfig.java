package de.bsommerfeld.updatecreator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Global configuration, stored as {@code config.yaml} in the application data directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreatorConfig {

    @JsonProperty("check-hash")
    private boolean checkHash = true;

    @JsonProperty("update-name-prefix")
    private String updateNamePrefix = "WSO2-CARBON-UPDATE";

    @JsonProperty("staging-directory")
    private String stagingDirectory = "temp";

    @JsonProperty("output-directory")
    private String outputDirectory = ".";

    /** Directory inside the package that mirrors the distribution root. */
    @JsonProperty("carbon-home")
    private String carbonHome = "carbon.home";

    @JsonProperty("resource-files")
    private ResourceFilesConfig resourceFiles = new ResourceFilesConfig();

    public boolean isCheckHash() {
        return checkHash;
    }

    public void setCheckHash(boolean checkHash) {
        this.checkHash = checkHash;
    }

    public String getUpdateNamePrefix() {
        return updateNamePrefix;
    }

    public void setUpdateNamePrefix(String updateNamePrefix) {
        this.updateNamePrefix = updateNamePrefix;
    }

    public String getStagingDirectory() {
        return stagingDirectory;
    }

    public void setStagingDirectory(String stagingDirectory) {
        this.stagingDirectory = stagingDirectory;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getCarbonHome() {
        return carbonHome;
    }

    public void setCarbonHome(String carbonHome) {
        this.carbonHome = carbonHome;
    }

    public ResourceFilesConfig getResourceFiles() {
        return resourceFiles;
    }
}
