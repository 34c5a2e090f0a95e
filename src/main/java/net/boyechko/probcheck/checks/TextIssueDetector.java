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
import java.util.Optional;
import java.util.Set;
import net.boyechko.probcheck.document.TextStreams;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.validation.StatementCheck;
import net.boyechko.probcheck.validation.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the statement checks over classified text and raw lines. The checks are independent: each
 * runs regardless of what the others find.
 */
public class TextIssueDetector {
    private static final Logger logger = LoggerFactory.getLogger(TextIssueDetector.class);

    private final List<StatementCheck> checks;

    public TextIssueDetector(List<StatementCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    /** Returns a detector with the spelling, math formatting and given line rules. */
    public static TextIssueDetector withLineRules(List<LineRule> lineRules) {
        return new TextIssueDetector(
                List.of(
                        new SpellingCheck(),
                        new MathFormattingCheck(),
                        new LineStyleCheck(lineRules)));
    }

    public List<StatementCheck> getChecks() {
        return checks;
    }

    public IssueList detect(
            IssueLoc where,
            String plainText,
            String mathText,
            List<String> rawLines,
            Optional<Set<String>> dictionary) {
        return detect(
                new StatementContext(
                        where,
                        Optional.of(new TextStreams(plainText, mathText)),
                        rawLines,
                        dictionary));
    }

    public IssueList detect(StatementContext ctx) {
        IssueList all = new IssueList();
        for (StatementCheck check : checks) {
            IssueList found = check.findIssues(ctx);
            if (found.isEmpty()) {
                logger.debug("{} ({})", check.passedMessage(), ctx.where().key());
            }
            all.addAll(found);
        }
        return all;
    }
}
