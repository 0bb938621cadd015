package com.toonlens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toonlens.core.parser.ParserOptions;
import com.toonlens.core.serializer.SerializerOptions;

import java.util.List;

/**
 * Root configuration for Toon Lens.
 *
 * <p>Loaded from {@code .toonlens.yaml}. Every section is optional; missing sections and
 * missing keys fall back to the library defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   maxNestingDepth: 64
 *
 * format:
 *   indent: "    "
 *   lineEnding: "\n"
 *
 * validators:
 *   disabled:
 *     - line-syntax
 * }</pre>
 *
 * @param parser parser settings
 * @param format serializer settings
 * @param validators validator selection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToonConfig(
    @JsonProperty("parser") ParserSettings parser,
    @JsonProperty("format") FormatSettings format,
    @JsonProperty("validators") ValidatorSettings validators
) {
    public ToonConfig {
        parser = parser != null ? parser : ParserSettings.defaults();
        format = format != null ? format : FormatSettings.defaults();
        validators = validators != null ? validators : ValidatorSettings.defaults();
    }

    /**
     * Creates the default configuration: library defaults and every validator enabled.
     *
     * @return default configuration
     */
    public static ToonConfig defaults() {
        return new ToonConfig(null, null, null);
    }

    /**
     * Parser settings.
     *
     * @param maxNestingDepth deepest block nesting accepted
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserSettings(
        @JsonProperty("maxNestingDepth") Integer maxNestingDepth
    ) {
        public static ParserSettings defaults() {
            return new ParserSettings(ParserOptions.DEFAULT_MAX_NESTING_DEPTH);
        }

        public ParserOptions toOptions() {
            return new ParserOptions(maxNestingDepth != null
                ? maxNestingDepth
                : ParserOptions.DEFAULT_MAX_NESTING_DEPTH);
        }
    }

    /**
     * Serializer settings.
     *
     * @param indent indentation unit
     * @param lineEnding line separator
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FormatSettings(
        @JsonProperty("indent") String indent,
        @JsonProperty("lineEnding") String lineEnding
    ) {
        public static FormatSettings defaults() {
            return new FormatSettings(SerializerOptions.DEFAULT_INDENT, SerializerOptions.DEFAULT_LINE_ENDING);
        }

        public SerializerOptions toOptions() {
            return new SerializerOptions(
                indent != null ? indent : SerializerOptions.DEFAULT_INDENT,
                lineEnding != null ? lineEnding : SerializerOptions.DEFAULT_LINE_ENDING);
        }
    }

    /**
     * Validator selection.
     *
     * @param disabled ids of validators to skip
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidatorSettings(
        @JsonProperty("disabled") List<String> disabled
    ) {
        public ValidatorSettings {
            disabled = disabled != null ? List.copyOf(disabled) : List.of();
        }

        public static ValidatorSettings defaults() {
            return new ValidatorSettings(List.of());
        }

        public boolean isEnabled(String validatorId) {
            return !disabled.contains(validatorId);
        }
    }
}
