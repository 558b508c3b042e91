package com.textdiagram.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads render and output settings for diagram rendering from {@code textdiagram.yaml}.
 *
 * <p>The settings only tune how a diagram is written out: the column limit handed to the
 * layout engines and whether the output ends with a line break. A diagram can always be
 * rendered without them, so a file that is absent, unreadable or rejected degrades to
 * {@link TextDiagramConfig#defaults()} (natural width, trailing newline) with a log line
 * instead of failing the render.
 *
 * <pre>{@code
 * TextDiagramConfig config = ConfigLoader.load(Paths.get("textdiagram.yaml"));
 * Integer maxWidth = config.render().maxWidth();
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up in the working directory when no path is given. */
    public static final String DEFAULT_FILE_NAME = "textdiagram.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads render settings.
     *
     * @param configPath path to a {@code textdiagram.yaml}
     * @return the settings in the file, or the defaults if it cannot be used
     */
    public static TextDiagramConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("No render settings at {}, rendering at natural width", configPath);
            return TextDiagramConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Render settings {} cannot be read, rendering at natural width", configPath);
            return TextDiagramConfig.defaults();
        }

        try {
            TextDiagramConfig config = YAML_MAPPER.readValue(configPath.toFile(), TextDiagramConfig.class);
            if (config == null) {
                log.warn("Render settings {} are empty, rendering at natural width", configPath);
                return TextDiagramConfig.defaults();
            }
            log.debug("Render settings from {}: maxWidth={}, trailingNewline={}", configPath,
                config.render().maxWidth(), config.output().trailingNewline());
            return config;
        } catch (ValueInstantiationException e) {
            log.error("Rejected render setting in {}: {}", configPath, e.getCause() != null
                ? e.getCause().getMessage() : e.getOriginalMessage());
            return TextDiagramConfig.defaults();
        } catch (IOException e) {
            log.error("Render settings {} are not valid YAML, rendering at natural width: {}",
                configPath, e.getMessage());
            return TextDiagramConfig.defaults();
        }
    }
}
