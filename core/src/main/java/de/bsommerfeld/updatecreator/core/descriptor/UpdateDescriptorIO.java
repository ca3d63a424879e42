package de.bsommerfeld.updatecreator.core.descriptor;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import de.bsommerfeld.updatecreator.core.config.ResourceFilesConfig;
import de.bsommerfeld.updatecreator.core.error.CopyException;
import de.bsommerfeld.updatecreator.core.error.DescriptorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads, validates and writes {@code update-descriptor.yaml}.
 */
public final class UpdateDescriptorIO {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateDescriptorIO.class);

    private static final Pattern UPDATE_NUMBER = Pattern.compile("^\\d{4}$");
    private static final Pattern PLATFORM_VERSION = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS));

    /**
     * Reads the descriptor from the given update directory.
     *
     * @throws DescriptorException if the file is missing or not valid YAML
     */
    public UpdateDescriptor load(Path updateDirectory) throws DescriptorException {
        Path file = updateDirectory.resolve(ResourceFilesConfig.UPDATE_DESCRIPTOR_FILE);
        if (!Files.isRegularFile(file)) {
            throw new DescriptorException("'" + ResourceFilesConfig.UPDATE_DESCRIPTOR_FILE
                    + "' not found at '" + updateDirectory + "'.");
        }
        try {
            UpdateDescriptor descriptor = mapper.readValue(file.toFile(), UpdateDescriptor.class);
            LOG.debug("Loaded descriptor {}", descriptor);
            return descriptor == null ? UpdateDescriptor.template() : descriptor;
        } catch (JacksonException e) {
            throw new DescriptorException("'" + file + "' format is not correct: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DescriptorException("Error occurred when reading '" + file + "'", e);
        }
    }

    /**
     * Checks the fields the package name is derived from.
     *
     * @throws DescriptorException describing the first invalid field
     */
    public void validate(UpdateDescriptor descriptor) throws DescriptorException {
        if (!UPDATE_NUMBER.matcher(descriptor.updateNumber()).matches()) {
            throw new DescriptorException("'update_number' must have 4 digits, found '"
                    + descriptor.updateNumber() + "'");
        }
        if (!PLATFORM_VERSION.matcher(descriptor.platformVersion()).matches()) {
            throw new DescriptorException("'platform_version' must look like 1.2.3, found '"
                    + descriptor.platformVersion() + "'");
        }
        if (descriptor.platformName().isBlank()) {
            throw new DescriptorException("'platform_name' is empty");
        }
    }

    public void write(Path file, UpdateDescriptor descriptor) throws CopyException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), descriptor);
        } catch (IOException e) {
            throw new CopyException("Failed to write '" + file + "'", e);
        }
    }

    /**
     * Creates {@code directory} if needed and writes a blank descriptor into it.
     *
     * @return the written file
     */
    public Path writeTemplate(Path directory) throws CopyException {
        Path file = directory.resolve(ResourceFilesConfig.UPDATE_DESCRIPTOR_FILE);
        write(file, UpdateDescriptor.template());
        LOG.info("Created {}", file);
        return file;
    }
}
