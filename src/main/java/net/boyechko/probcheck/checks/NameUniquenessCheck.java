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
package net.boyechko.probcheck.checks;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Checks the problems being audited against a cache of names already published, one per line. */
public class NameUniquenessCheck {
    private static final Logger logger = LoggerFactory.getLogger(NameUniquenessCheck.class);

    private final Optional<Path> cacheFile;

    public NameUniquenessCheck(Optional<Path> cacheFile) {
        this.cacheFile = cacheFile;
    }

    public String name() {
        return "Problem Name Check";
    }

    public IssueList findIssues(Collection<String> problemNames) {
        Set<String> usedNames = loadUsedNames();
        if (usedNames.isEmpty()) {
            return new IssueList(
                    new Issue(
                            IssueType.NAME_CHECK_UNAVAILABLE,
                            IssueSev.ERROR,
                            IssueLoc.general(),
                            "could not check whether problem names are already used"));
        }

        SortedSet<String> nonUnique = new TreeSet<>(problemNames);
        nonUnique.retainAll(usedNames);
        if (nonUnique.isEmpty()) {
            return new IssueList();
        }
        return new IssueList(
                new Issue(
                        IssueType.NAME_ALREADY_USED,
                        IssueSev.ERROR,
                        IssueLoc.general(),
                        "some problems use names already in use: "
                                + QuotedList.of(nonUnique)));
    }

    private Set<String> loadUsedNames() {
        Set<String> names = new HashSet<>();
        if (cacheFile.isEmpty()) {
            return names;
        }
        try (Stream<String> lines = Files.lines(cacheFile.get(), StandardCharsets.UTF_8)) {
            lines.map(String::strip).filter(line -> !line.isEmpty()).forEach(names::add);
        } catch (IOException e) {
            logger.warn(
                    "Could not read problem name cache {}: {}", cacheFile.get(), e.getMessage());
        }
        logger.debug("Loaded {} used problem names", names.size());
        return names;
    }
}
