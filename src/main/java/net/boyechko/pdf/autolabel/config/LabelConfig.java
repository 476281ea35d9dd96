/*
 * PDF-Auto-Label - Automated label numbering for tagged documents
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autolabel.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.autolabel.document.ElementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Default label templates and rendering modes per element kind, loaded from YAML:
 *
 * <pre>
 * headings:
 *   template: "H.1 ,*"
 *   level: 2
 * ordered_lists:
 *   template: "1. ,(a) ,(i) ,*"
 *   render: css
 * </pre>
 */
public final class LabelConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/label-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(LabelConfig.class);

    public KindConfig headings;
    public KindConfig ordered_lists;
    public KindConfig unordered_lists;
    public KindConfig figures;
    public KindConfig tables;

    public static final class KindConfig {
        /** Template source; null means the kind is not labelled unless a directive asks for it. */
        public String template;

        /** Heading level the template starts at; headings only, defaults to 1. */
        public Integer level;

        /** {@code text} (default) or {@code css}. */
        public String render;

        public KindConfig() {}

        public KindConfig(String template) {
            this.template = template;
        }
    }

    /** Returns the section for a kind, or null if the kind has none. List items use their list's. */
    public KindConfig forKind(ElementKind kind) {
        return switch (kind) {
            case HEADING -> headings;
            case ORDERED_LIST -> ordered_lists;
            case UNORDERED_LIST -> unordered_lists;
            case FIGURE -> figures;
            case TABLE -> tables;
            default -> null;
        };
    }

    public String templateFor(ElementKind kind) {
        KindConfig section = forKind(kind);
        return section != null ? section.template : null;
    }

    public String renderFor(ElementKind kind) {
        KindConfig section = forKind(kind);
        return section != null ? section.render : null;
    }

    /** The heading level at which the default heading template applies. */
    public int headingLevel() {
        if (headings == null || headings.level == null) {
            return 1;
        }
        return headings.level;
    }

    /** Sets the template for a kind, creating its section if needed. Returns this config. */
    public LabelConfig withTemplate(ElementKind kind, String template) {
        section(kind).template = template;
        return this;
    }

    public LabelConfig withRender(ElementKind kind, String render) {
        section(kind).render = render;
        return this;
    }

    public LabelConfig withHeadingLevel(int level) {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be 1..6, got " + level);
        }
        section(ElementKind.HEADING).level = level;
        return this;
    }

    private KindConfig section(ElementKind kind) {
        KindConfig section = forKind(kind);
        if (section != null) {
            return section;
        }
        section = new KindConfig();
        switch (kind) {
            case HEADING -> headings = section;
            case ORDERED_LIST -> ordered_lists = section;
            case UNORDERED_LIST -> unordered_lists = section;
            case FIGURE -> figures = section;
            case TABLE -> tables = section;
            default -> throw new IllegalArgumentException(kind + " has no label configuration");
        }
        return section;
    }

    /**
     * Load LabelConfig from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static LabelConfig fromResource(String resourcePath) {
        try (InputStream inputStream = LabelConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            LabelConfig config = load(inputStream);
            logger.debug("Loaded label configuration from resource {}", resourcePath);
            return config;
        } catch (Exception e) {
            logger.error(
                    "Failed to load label configuration from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load label configuration from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    public static LabelConfig fromFile(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            LabelConfig config = load(inputStream);
            logger.debug("Loaded label configuration from {}", path);
            return config;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to load label configuration from {}: {}", path, e.getMessage());
            throw new RuntimeException(
                    "Failed to load label configuration from " + path + ": " + e.getMessage(), e);
        }
    }

    private static LabelConfig load(InputStream inputStream) {
        var yaml = new Yaml(new Constructor(LabelConfig.class, new LoaderOptions()));
        LabelConfig config = yaml.load(inputStream);
        // An empty document loads as null
        return config != null ? config : none();
    }

    /** Load default configuration from standard location */
    public static LabelConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    /** A configuration with no default templates: only directives produce labels. */
    public static LabelConfig none() {
        return new LabelConfig();
    }
}
