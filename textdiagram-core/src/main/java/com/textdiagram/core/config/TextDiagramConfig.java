package com.textdiagram.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for TextDiagram.
 *
 * <p>Loaded from {@code textdiagram.yaml}. Missing sections fall back to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * render:
 *   maxWidth: 100
 *
 * output:
 *   trailingNewline: true
 * }</pre>
 *
 * @param render layout settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TextDiagramConfig(
    @JsonProperty("render") RenderSettings render,
    @JsonProperty("output") OutputSettings output
) {
    public TextDiagramConfig {
        if (render == null) {
            render = RenderSettings.defaults();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Creates the default configuration: natural width, output ends with a newline.
     *
     * @return default configuration
     */
    public static TextDiagramConfig defaults() {
        return new TextDiagramConfig(RenderSettings.defaults(), OutputSettings.defaults());
    }

    /**
     * Layout settings.
     *
     * @param maxWidth maximum diagram width in columns, null for no limit
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderSettings(
        @JsonProperty("maxWidth") Integer maxWidth
    ) {
        public RenderSettings {
            if (maxWidth != null && maxWidth < 1) {
                throw new IllegalArgumentException("render.maxWidth must be positive, got " + maxWidth);
            }
        }

        public static RenderSettings defaults() {
            return new RenderSettings(null);
        }
    }

    /**
     * Output settings.
     *
     * @param trailingNewline whether written output ends with a line break
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("trailingNewline") Boolean trailingNewline
    ) {
        public OutputSettings {
            if (trailingNewline == null) {
                trailingNewline = Boolean.TRUE;
            }
        }

        public static OutputSettings defaults() {
            return new OutputSettings(true);
        }
    }
}
