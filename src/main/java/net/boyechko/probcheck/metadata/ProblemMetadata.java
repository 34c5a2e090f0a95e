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
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/** The metadata a problem declares in its {@code problem.yaml}, exactly as written. */
public final class ProblemMetadata {
    public static final String FILE_NAME = "problem.yaml";

    private final Object declared;

    private ProblemMetadata(Object declared) {
        this.declared = declared;
    }

    public static ProblemMetadata load(Path problemDir) throws IOException {
        Path file = problemDir.resolve(FILE_NAME);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            return new ProblemMetadata(yaml.load(reader));
        }
    }

    public static ProblemMetadata of(Object declared) {
        return new ProblemMetadata(declared);
    }

    /** The parsed document: usually a map, {@code null} for an empty file. */
    public Object declared() {
        return declared;
    }

    public boolean isPresent() {
        return declared instanceof Map<?, ?>;
    }

    /**
     * The problem's title: {@code name.en}, else the first value of {@code name}, or {@code name}
     * itself when it is a plain string.
     */
    public Optional<String> title() {
        if (!(declared instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        Object name = map.get("name");
        if (name instanceof Map<?, ?> names) {
            Object english = names.get("en");
            if (english != null) {
                return Optional.of(english.toString());
            }
            Iterator<?> values = names.values().iterator();
            return values.hasNext()
                    ? Optional.ofNullable(values.next()).map(Object::toString)
                    : Optional.empty();
        }
        return name != null ? Optional.of(name.toString()) : Optional.empty();
    }

    /**
     * The value in effect for a top-level key: the declared value, else the schema default.
     *
     * @throws IllegalStateException when there is no metadata to look the key up in
     */
    public Object effectiveValue(String key, Map<String, Object> defaults) {
        if (!(declared instanceof Map<?, ?> map)) {
            throw new IllegalStateException("there is no metadata");
        }
        return map.containsKey(key) ? map.get(key) : defaults.get(key);
    }
}
