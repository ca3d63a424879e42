package de.bsommerfeld.updatecreator.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link CreatorConfig} from a YAML file. A missing file is created with the
 * defaults so users have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    public CreatorConfig load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            CreatorConfig defaults = new CreatorConfig();
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(configFile.toFile(), defaults);
            LOG.info("Wrote default configuration to {}", configFile.toAbsolutePath());
            return defaults;
        }
        LOG.debug("Loading configuration from {}", configFile.toAbsolutePath());
        return mapper.readValue(configFile.toFile(), CreatorConfig.class);
    }
}
