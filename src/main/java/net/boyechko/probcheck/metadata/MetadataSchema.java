/*
 * Problem-Check - Problem Package Auditor
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
package net.boyechko.probcheck.metadata;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * The baseline a problem's {@code problem.yaml} is compared against. Mandatory keys have no
 * default; optional keys map to their default value or to a nested map of further defaults.
 */
public final class MetadataSchema {
    private static final String DEFAULT_SCHEMA_RESOURCE = "/problem-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(MetadataSchema.class);

    public List<String> mandatory;
    public Map<String, Object> optional;

    public MetadataSchema() {
        this.mandatory = new ArrayList<>();
        this.optional = new LinkedHashMap<>();
    }

    public List<String> getMandatory() {
        return mandatory;
    }

    public Map<String, Object> getOptional() {
        return optional;
    }

    /**
     * Load MetadataSchema from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static MetadataSchema fromResource(String resourcePath) {
        try (InputStream inputStream = MetadataSchema.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            MetadataSchema schema = load(inputStream);
            logger.debug(
                    "Loaded MetadataSchema with {} mandatory and {} optional keys from resource {}",
                    schema.mandatory.size(),
                    schema.optional.size(),
                    resourcePath);
            return schema;
        } catch (IOException | RuntimeException e) {
            logger.error(
                    "Failed to load MetadataSchema from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load schema from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load a schema from a YAML file on disk, e.g. one given with {@code --defaults}. */
    public static MetadataSchema fromFile(Path file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(file)) {
            MetadataSchema schema = load(inputStream);
            logger.debug("Loaded MetadataSchema from {}", file);
            return schema;
        }
    }

    /** Load default schema from standard location */
    public static MetadataSchema loadDefault() {
        return fromResource(DEFAULT_SCHEMA_RESOURCE);
    }

    /** Builds a schema whose optional section is {@code optional}, with no mandatory keys. */
    public static MetadataSchema of(Map<String, Object> optional) {
        MetadataSchema schema = new MetadataSchema();
        schema.optional.putAll(optional);
        return schema;
    }

    private static MetadataSchema load(InputStream inputStream) {
        Yaml yaml = new Yaml(new Constructor(MetadataSchema.class, new LoaderOptions()));
        MetadataSchema schema = yaml.load(inputStream);
        if (schema == null) {
            throw new IllegalArgumentException("schema document is empty");
        }
        if (schema.mandatory == null) {
            schema.mandatory = new ArrayList<>();
        }
        if (schema.optional == null) {
            schema.optional = new LinkedHashMap<>();
        }
        return schema;
    }

    /**
     * Returns every known key mapped to its default. Mandatory keys map to {@code null}, which
     * also overrides an optional entry of the same name.
     */
    public Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>(optional);
        for (String key : mandatory) {
            defaults.put(key, null);
        }
        return Collections.unmodifiableMap(defaults);
    }
}
