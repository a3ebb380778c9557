package dev.badgersnacks.packmigrator.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ConverterOptions} from an optional JSON settings file.
 *
 * <p>Every property is optional, for example:
 * <pre>
 * {
 *   "targetVersion": "1.21.4",
 *   "predicateEncoding": "SELECT",
 *   "builtInNamespaces": ["minecraft"],
 *   "relocations": [{"kind": "MODEL", "from": "models/item/custom", "to": "models/custom"}]
 * }
 * </pre>
 * Missing or malformed files fall back to {@link ConverterOptions#defaults()}.
 */
public final class ConverterSettings {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConverterSettings.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public ConverterOptions load(Path settingsFile) {
        if (settingsFile == null) {
            return ConverterOptions.defaults();
        }
        if (!Files.isRegularFile(settingsFile)) {
            LOGGER.warn("Settings file {} does not exist, using defaults", settingsFile);
            return ConverterOptions.defaults();
        }
        try {
            ConverterOptions options = mapper.readValue(settingsFile.toFile(), ConverterOptions.class);
            if (options == null) {
                LOGGER.warn("Settings file {} is empty, using defaults", settingsFile);
                return ConverterOptions.defaults();
            }
            LOGGER.info("Using converter settings from {} (target {}, encoding {})",
                    settingsFile, options.targetVersion(), options.encoding());
            return options;
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Failed to load converter settings from {}, using defaults", settingsFile, e);
            return ConverterOptions.defaults();
        }
    }
}
