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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.probcheck.core.ProblemContext;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.validation.ProblemCheck;

/** Flags statement images bigger than 200 kB. */
public class LargeImageCheck implements ProblemCheck {
    static final long MAX_IMAGE_BYTES = 200 * 1024;

    private static final List<String> IMAGE_SUFFIXES =
            List.of(".jpg", ".jpeg", ".png", ".pdf", ".svg");

    @Override
    public String name() {
        return "Large Image Check";
    }

    @Override
    public IssueList findIssues(ProblemContext ctx) throws IOException {
        IssueList issues = new IssueList();
        for (Path file : ctx.listStatementDirectory()) {
            if (!isImage(file)) {
                continue;
            }
            long size = Files.size(file);
            if (size > MAX_IMAGE_BYTES) {
                issues.add(
                        new Issue(
                                IssueType.LARGE_IMAGE,
                                IssueSev.WARNING,
                                ctx.locate(file),
                                "image is large ("
                                        + size / 1024
                                        + " kB) -- try to keep images under 200kB"));
            }
        }
        return issues;
    }

    static boolean isImage(Path file) {
        String name = file.getFileName().toString();
        return IMAGE_SUFFIXES.stream().anyMatch(name::endsWith);
    }
}
