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
package net.boyechko.probcheck.core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.probcheck.ProblemTestBase;
import org.junit.jupiter.api.Test;

class ProblemDiscoveryTest extends ProblemTestBase {
    @Test
    void findsImmediateSubdirectoriesSortedByName() throws IOException {
        Path zebra = createProblem("zebra", "name: Zebra\n");
        Path apple = createProblem("apple", "name: Apple\n");
        Files.createDirectories(tempDir.resolve("notes"));
        Files.createDirectories(tempDir.resolve("deeper").resolve("nested"));
        Files.writeString(tempDir.resolve("deeper/nested/problem.yaml"), "name: Nested\n");

        assertEquals(List.of(apple, zebra), ProblemDiscovery.find(tempDir));
    }

    @Test
    void rootItselfCanBeAProblem() throws IOException {
        Path single = createProblem("single", "name: Single\n");

        assertEquals(List.of(single), ProblemDiscovery.find(single));
    }

    @Test
    void emptyDirectoryHasNoProblems() throws IOException {
        assertTrue(ProblemDiscovery.find(tempDir).isEmpty());
    }

    @Test
    void problemYamlMustBeAFile() throws IOException {
        Files.createDirectories(tempDir.resolve("odd").resolve("problem.yaml"));

        assertFalse(ProblemDiscovery.isProblem(tempDir.resolve("odd")));
    }
}
