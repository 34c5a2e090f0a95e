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
package net.boyechko.probcheck.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A problem statement source file together with the language its name declares. */
public record StatementFile(Path path, String language, String source) {
    public static final String DEFAULT_LANGUAGE = "en";

    private static final Pattern STATEMENT_NAME =
            Pattern.compile("problem(?:\\.([a-z][a-z]))?\\.tex");

    /**
     * Returns the language of a statement file named {@code problem.tex} or {@code
     * problem.<lang>.tex}, or empty if the name does not follow that convention.
     */
    public static Optional<String> languageOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher m = STATEMENT_NAME.matcher(fileName.toString());
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1) != null ? m.group(1) : DEFAULT_LANGUAGE);
    }

    public static StatementFile read(Path path) throws IOException {
        String language =
                languageOf(path)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Not a statement file name: " + path));
        return new StatementFile(path, language, Files.readString(path, StandardCharsets.UTF_8));
    }

    /** Raw source lines, without line terminators. */
    public List<String> lines() {
        return source.lines().toList();
    }
}
