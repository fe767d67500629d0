package com.rstfmt.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rstfmt.core.check.IdempotenceChecker;
import com.rstfmt.core.parser.MarkupRegistry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root configuration for rstfmt.
 *
 * <p>Loaded from {@code .rstfmt.yaml}. Every section is optional; missing sections and
 * keys fall back to the defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * format:
 *   width: 88
 *
 * registry:
 *   directives:
 *     - tabs
 *     - mermaid
 *   roles:
 *     - meth
 *     - doc
 *
 * check:
 *   widths: [1, 5, 72, 0]
 *   dumpDirectory: "/tmp/rstfmt"
 * }</pre>
 *
 * @param format formatting settings
 * @param registry extra directives and roles
 * @param check consistency check settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RstFmtConfig(
    @JsonProperty("format") FormatSettings format,
    @JsonProperty("registry") RegistrySettings registry,
    @JsonProperty("check") CheckSettings check
) {
    /** Width used when nothing is configured. */
    public static final int DEFAULT_WIDTH = 72;

    public RstFmtConfig {
        format = format != null ? format : new FormatSettings(null);
        registry = registry != null ? registry : new RegistrySettings(null, null);
        check = check != null ? check : new CheckSettings(null, null);
    }

    /**
     * Creates the default configuration: width 72, default registry, default check widths.
     *
     * @return default configuration
     */
    public static RstFmtConfig defaults() {
        return new RstFmtConfig(null, null, null);
    }

    /**
     * Builds the markup registry: the defaults plus the configured names.
     *
     * @return registry for the parser
     */
    public MarkupRegistry markupRegistry() {
        return MarkupRegistry.defaults()
            .withDirectives(registry.directives())
            .withRoles(registry.roles());
    }

    /**
     * Formatting settings.
     *
     * @param width target width; 0 or negative for unbounded
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FormatSettings(
        @JsonProperty("width") Integer width
    ) {
        public FormatSettings {
            width = width != null ? width : DEFAULT_WIDTH;
        }
    }

    /**
     * Registry extensions.
     *
     * @param directives directives kept verbatim in addition to the defaults
     * @param roles roles accepted without a diagnostic in addition to the defaults
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegistrySettings(
        @JsonProperty("directives") List<String> directives,
        @JsonProperty("roles") List<String> roles
    ) {
        public RegistrySettings {
            directives = directives != null ? List.copyOf(directives) : List.of();
            roles = roles != null ? List.copyOf(roles) : List.of();
        }
    }

    /**
     * Consistency check settings.
     *
     * @param widths widths to check; 0 or negative entries mean unbounded, empty means the defaults
     * @param dumpDirectory directory for failure dumps, or null for the system temporary directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CheckSettings(
        @JsonProperty("widths") List<Integer> widths,
        @JsonProperty("dumpDirectory") String dumpDirectory
    ) {
        public CheckSettings {
            widths = widths != null ? Collections.unmodifiableList(new ArrayList<>(widths)) : List.of();
        }

        /**
         * Returns the widths to check, with unbounded entries as null.
         *
         * @return widths for {@link IdempotenceChecker}
         */
        public List<Integer> effectiveWidths() {
            if (widths.isEmpty()) {
                return IdempotenceChecker.DEFAULT_WIDTHS;
            }
            List<Integer> result = new ArrayList<>(widths.size());
            for (Integer width : widths) {
                result.add(width != null && width > 0 ? width : null);
            }
            return result;
        }

        public Path dumpPath() {
            return dumpDirectory != null && !dumpDirectory.isBlank() ? Path.of(dumpDirectory) : null;
        }

        /**
         * Returns the configured dump directory, or the system temporary directory when none is set.
         *
         * @return directory for failure dumps
         */
        public Path dumpPathOrTemp() {
            Path configured = dumpPath();
            return configured != null ? configured : Path.of(System.getProperty("java.io.tmpdir"));
        }
    }
}
