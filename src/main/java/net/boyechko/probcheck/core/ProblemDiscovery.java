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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import net.boyechko.probcheck.metadata.ProblemMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Finds problem packages: directories holding a {@code problem.yaml}. */
public final class ProblemDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(ProblemDiscovery.class);

    private ProblemDiscovery() {}

    /**
     * Returns {@code root} and its immediate subdirectories (following links) that are problem
     * packages, sorted by problem name. Nothing deeper is searched.
     */
    public static List<Path> find(Path root) throws IOException {
        List<Path> problems = new ArrayList<>();
        if (isProblem(root)) {
            problems.add(root);
        }
        try (Stream<Path> entries = Files.list(root)) {
            entries.filter(Files::isDirectory)
                    .filter(ProblemDiscovery::isProblem)
                    .forEach(problems::add);
        }
        problems.sort(Comparator.comparing(ProblemContext::problemName));
        logger.debug("Found {} problem package(s) under {}", problems.size(), root);
        return problems;
    }

    public static boolean isProblem(Path dir) {
        return Files.isRegularFile(dir.resolve(ProblemMetadata.FILE_NAME));
    }
}
