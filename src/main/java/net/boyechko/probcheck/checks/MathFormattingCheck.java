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

import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.validation.StatementCheck;
import net.boyechko.probcheck.validation.StatementContext;

/**
 * Finds numbers in math mode that group thousands with a plain comma, or that have four or more
 * digits without any thousands separator.
 */
public class MathFormattingCheck implements StatementCheck {
    private static final Pattern INCORRECT_MATH =
            Pattern.compile("\\b([0-9]+[0-9,]*,[0-9]+|[0-9]{4,})\\b");

    @Override
    public String name() {
        return "Math Formatting Check";
    }

    @Override
    public IssueList findIssues(StatementContext ctx) {
        if (ctx.streams().isEmpty()) {
            return new IssueList();
        }

        SortedSet<String> incorrect = findIncorrectNumbers(ctx.streams().get().mathText());
        if (incorrect.isEmpty()) {
            return new IssueList();
        }
        return new IssueList(
                new Issue(
                        IssueType.INCORRECT_MATH,
                        IssueSev.WARNING,
                        ctx.where(),
                        "incorrect math: "
                                + QuotedList.of(incorrect)
                                + " (use `\\,` (backslash comma) to separate thousands groups)"));
    }

    static SortedSet<String> findIncorrectNumbers(String mathText) {
        SortedSet<String> incorrect = new TreeSet<>();
        Matcher m = INCORRECT_MATH.matcher(mathText);
        while (m.find()) {
            incorrect.add(m.group());
        }
        return incorrect;
    }
}
