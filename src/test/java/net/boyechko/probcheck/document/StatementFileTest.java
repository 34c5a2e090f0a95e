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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatementFileTest {

    @TempDir Path tempDir;

    @Test
    void languageComesFromFileName() {
        assertEquals(Optional.of("en"), StatementFile.languageOf(Path.of("problem.tex")));
        assertEquals(Optional.of("sv"), StatementFile.languageOf(Path.of("x/problem.sv.tex")));
        assertEquals(Optional.empty(), StatementFile.languageOf(Path.of("problem.swe.tex")));
        assertEquals(Optional.empty(), StatementFile.languageOf(Path.of("notes.tex")));
        assertEquals(Optional.empty(), StatementFile.languageOf(Path.of("problem.tex.bak")));
    }

    @Test
    void readKeepsRawLines() throws IOException {
        Path file = tempDir.resolve("problem.de.tex");
        Files.writeString(file, "first\n% second\nthird\n");

        StatementFile statement = StatementFile.read(file);

        assertEquals("de", statement.language());
        assertEquals(List.of("first", "% second", "third"), statement.lines());
    }

    @Test
    void readRejectsOtherFiles() throws IOException {
        Path file = tempDir.resolve("solution.tex");
        Files.writeString(file, "x");
        assertThrows(IllegalArgumentException.class, () -> StatementFile.read(file));
    }
}
