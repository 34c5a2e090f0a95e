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
package net.boyechko.probcheck.validation;

import static net.boyechko.probcheck.document.DocNode.generic;
import static net.boyechko.probcheck.document.DocNode.group;
import static net.boyechko.probcheck.document.DocNode.math;
import static net.boyechko.probcheck.document.DocNode.text;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.probcheck.document.DocNode;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import org.junit.jupiter.api.Test;

class DocTreeWalkerTest {
    private static final DocNode TREE =
            generic("document", text("a"), math(group(text("b"))), text("c"));

    @Test
    void visitsEveryNodeOnceInDocumentOrder() {
        RecordingVisitor recorder = new RecordingVisitor();
        new DocTreeWalker().addVisitor(recorder).walk(TREE);

        assertEquals(
                List.of(
                        "1:0:document:text",
                        "2:1:#text:text",
                        "3:1:math:text",
                        "4:2:bgroup:math",
                        "5:3:#text:math",
                        "6:1:#text:text"),
                recorder.entered);
        assertEquals(6, recorder.left.size(), "Every entered node should be left");
    }

    @Test
    void returningFalseSkipsChildren() {
        RecordingVisitor pruning =
                new RecordingVisitor() {
                    @Override
                    public boolean enterNode(DocTreeContext ctx) {
                        super.enterNode(ctx);
                        return !ctx.is(DocNode.Kind.MATH_ENVIRONMENT);
                    }
                };
        new DocTreeWalker().addVisitor(pruning).walk(TREE);

        assertEquals(4, pruning.entered.size());
        assertTrue(pruning.entered.stream().noneMatch(e -> e.contains("bgroup")));
    }

    @Test
    void failingVisitorDoesNotStopOthers() {
        DocTreeVisitor failing =
                new DocTreeVisitor() {
                    @Override
                    public String name() {
                        return "Failing";
                    }

                    @Override
                    public String description() {
                        return "Throws on every node";
                    }

                    @Override
                    public boolean enterNode(DocTreeContext ctx) {
                        throw new IllegalStateException("boom");
                    }
                };
        RecordingVisitor recorder = new RecordingVisitor();

        new DocTreeWalker().addVisitor(failing).addVisitor(recorder).walk(TREE);

        assertEquals(6, recorder.entered.size());
    }

    @Test
    void issuesFromAllVisitorsAreCollected() {
        RecordingVisitor recorder = new RecordingVisitor();
        IssueList issues = new DocTreeWalker().addVisitor(recorder).walk(TREE);

        assertEquals(1, issues.size());
        assertEquals("6 nodes", issues.get(0).message());
    }

    private static class RecordingVisitor implements DocTreeVisitor {
        final List<String> entered = new ArrayList<>();
        final List<String> left = new ArrayList<>();

        @Override
        public String name() {
            return "Recorder";
        }

        @Override
        public String description() {
            return "Records traversal order";
        }

        @Override
        public boolean enterNode(DocTreeContext ctx) {
            entered.add(
                    ctx.globalIndex()
                            + ":"
                            + ctx.depth()
                            + ":"
                            + ctx.node().name()
                            + ":"
                            + (ctx.inMath() ? "math" : "text"));
            return true;
        }

        @Override
        public void leaveNode(DocTreeContext ctx) {
            left.add(ctx.path());
        }

        @Override
        public IssueList getIssues() {
            return new IssueList(
                    new Issue(IssueType.GENERAL, IssueSev.WARNING, entered.size() + " nodes"));
        }
    }
}
