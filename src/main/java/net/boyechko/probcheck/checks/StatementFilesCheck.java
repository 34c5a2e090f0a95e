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
import java.nio.file.Path;
import java.util.Optional;
import net.boyechko.probcheck.core.Collaborator;
import net.boyechko.probcheck.core.ProblemContext;
import net.boyechko.probcheck.document.DocNode;
import net.boyechko.probcheck.document.MarkupParseException;
import net.boyechko.probcheck.document.MarkupParser;
import net.boyechko.probcheck.document.StatementFile;
import net.boyechko.probcheck.document.TextStreams;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.validation.ProblemCheck;
import net.boyechko.probcheck.validation.StatementContext;
import net.boyechko.probcheck.visitors.TextClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses each statement file of a problem, classifies its text and runs the text issue detector
 * over it. A statement that cannot be parsed still gets its line checks.
 */
public class StatementFilesCheck implements ProblemCheck {
    private static final Logger logger = LoggerFactory.getLogger(StatementFilesCheck.class);

    private final TextIssueDetector detector;

    public StatementFilesCheck(TextIssueDetector detector) {
        this.detector = detector;
    }

    @Override
    public String name() {
        return "Statement Check";
    }

    @Override
    public IssueList findIssues(ProblemContext ctx) throws IOException {
        IssueList issues = new IssueList();
        Collaborator<MarkupParser> parser = ctx.parser();
        if (!parser.isAvailable()) {
            issues.add(
                    new Issue(
                            IssueType.COLLABORATOR_UNAVAILABLE,
                            IssueSev.ERROR,
                            ctx.where(),
                            parser.unavailableMessage()));
        }

        for (Path file : ctx.statementFiles()) {
            StatementFile statement = StatementFile.read(file);
            IssueLoc where = ctx.locate(file);
            logger.debug("Checking {} ({})", where.key(), statement.language());

            Optional<TextStreams> streams = Optional.empty();
            if (parser.isAvailable()) {
                try {
                    DocNode root = parser.get().parse(statement.source());
                    streams = Optional.of(TextClassifier.classify(root));
                } catch (MarkupParseException e) {
                    issues.add(
                            new Issue(
                                    IssueType.TEX_PARSE_FAILED,
                                    IssueSev.WARNING,
                                    where,
                                    "could not parse tex: " + e.getMessage()));
                } catch (StackOverflowError e) {
                    logger.debug("Walking {} overflowed the stack", where.key());
                    issues.add(
                            new Issue(
                                    IssueType.TEX_PARSE_FAILED,
                                    IssueSev.WARNING,
                                    where,
                                    "could not parse tex: nesting too deep"));
                }
            }

            issues.addAll(
                    detector.detect(
                            new StatementContext(
                                    where,
                                    streams,
                                    statement.lines(),
                                    ctx.dictionaries().forLanguage(statement.language()))));
        }
        return issues;
    }
}
