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

import java.util.List;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.validation.StatementCheck;
import net.boyechko.probcheck.validation.StatementContext;

/** Tests raw statement lines against line rules. Each rule is reported at most once per file. */
public class LineStyleCheck implements StatementCheck {
    private final List<LineRule> rules;

    public LineStyleCheck(List<LineRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public String name() {
        return "Line Style Check";
    }

    @Override
    public IssueList findIssues(StatementContext ctx) {
        IssueList issues = new IssueList();
        for (LineRule rule : rules) {
            if (ctx.rawLines().stream().anyMatch(rule::matches)) {
                issues.add(new Issue(rule.type(), IssueSev.WARNING, ctx.where(), rule.message()));
            }
        }
        return issues;
    }
}
