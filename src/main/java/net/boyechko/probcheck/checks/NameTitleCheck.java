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
import java.util.Locale;
import java.util.Optional;
import net.boyechko.probcheck.core.ProblemContext;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.validation.ProblemCheck;

/**
 * The directory name should be the title with everything but ASCII letters and digits removed,
 * lowercased: "Hello, World!" lives in {@code helloworld}.
 */
public class NameTitleCheck implements ProblemCheck {

    @Override
    public String name() {
        return "Name/Title Check";
    }

    @Override
    public IssueList findIssues(ProblemContext ctx) throws IOException {
        Optional<String> title = ctx.metadata().title();
        if (title.isEmpty() || matches(ctx.name(), title.get())) {
            return new IssueList();
        }
        return new IssueList(
                new Issue(
                        IssueType.NAME_TITLE_MISMATCH,
                        IssueSev.WARNING,
                        ctx.where(),
                        "use matching directory name and title: "
                                + ctx.name()
                                + " \""
                                + title.get()
                                + "\""));
    }

    static boolean matches(String name, String title) {
        return name.equals(title.replaceAll("[^a-zA-Z0-9]", "").toLowerCase(Locale.ROOT));
    }
}
