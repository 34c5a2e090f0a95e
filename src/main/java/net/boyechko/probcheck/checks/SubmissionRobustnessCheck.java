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
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import net.boyechko.probcheck.core.ProblemContext;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.submissions.Submission;
import net.boyechko.probcheck.submissions.SubmissionInventory;
import net.boyechko.probcheck.submissions.Verdict;
import net.boyechko.probcheck.validation.ProblemCheck;

/**
 * A robust package has wrong and too-slow solutions to test its data against, more than one
 * accepted solution, and at least one accepted solution in a language other than C or C++ so time
 * limits are known to be fair.
 */
public class SubmissionRobustnessCheck implements ProblemCheck {
    private static final Pattern FAST_LANGUAGE = Pattern.compile("\\bC(\\+\\+)?\\b");

    @Override
    public String name() {
        return "Submission Robustness Check";
    }

    @Override
    public IssueList findIssues(ProblemContext ctx) throws IOException {
        return findIssues(ctx, ctx.submissions());
    }

    IssueList findIssues(ProblemContext ctx, SubmissionInventory inventory) {
        IssueList issues = new IssueList();
        if (inventory.count(Verdict.WA) == 0) {
            issues.add(warning(ctx, IssueType.NO_WA_SUBMISSIONS, "has no WA submissions"));
        }
        if (inventory.count(Verdict.TLE) == 0) {
            issues.add(warning(ctx, IssueType.NO_TLE_SUBMISSIONS, "has no TLE submissions"));
        }
        if (inventory.count(Verdict.AC) == 1) {
            issues.add(warning(ctx, IssueType.SINGLE_AC_SUBMISSION, "has only one AC submission"));
        }

        Set<String> acceptedLanguages = new TreeSet<>();
        for (Submission submission : inventory.get(Verdict.AC)) {
            acceptedLanguages.add(submission.language());
        }
        boolean hasSlow =
                acceptedLanguages.stream()
                        .anyMatch(lang -> !FAST_LANGUAGE.matcher(lang).lookingAt());
        if (!hasSlow) {
            issues.add(
                    warning(
                            ctx,
                            IssueType.NO_SLOW_AC_SUBMISSION,
                            "there are no \"slow\" accepted submissions (only: "
                                    + String.join(", ", acceptedLanguages)
                                    + ")"));
        }
        return issues;
    }

    private static Issue warning(ProblemContext ctx, IssueType type, String message) {
        return new Issue(type, IssueSev.WARNING, ctx.where(), message);
    }
}
