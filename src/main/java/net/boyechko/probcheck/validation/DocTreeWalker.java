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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.probcheck.document.DocNode;
import net.boyechko.probcheck.issue.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a document tree once, depth-first and in document order, invoking multiple visitors at
 * each node. Each node is visited exactly once.
 */
public class DocTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(DocTreeWalker.class);

    private final List<DocTreeVisitor> visitors = new ArrayList<>();

    private int globalIndex;

    public DocTreeWalker addVisitor(DocTreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(DocNode root) {
        this.globalIndex = 0;

        for (DocTreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        walkNode(root, "/", 0, false);

        IssueList allIssues = new IssueList();
        for (DocTreeVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }

        return allIssues;
    }

    private void walkNode(DocNode node, String parentPath, int depth, boolean inMath) {
        globalIndex++;

        String path = parentPath + node.name() + "[" + globalIndex + "]";
        DocTreeContext ctx = new DocTreeContext(node, inMath, path, depth, globalIndex);

        boolean continueToChildren = true;
        for (DocTreeVisitor visitor : visitors) {
            try {
                if (!visitor.enterNode(ctx)) {
                    continueToChildren = false;
                }
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }

        if (continueToChildren) {
            boolean childrenInMath = ctx.childrenInMath();
            for (DocNode child : node.children()) {
                walkNode(child, ctx.path() + ".", depth + 1, childrenInMath);
            }
        }

        for (DocTreeVisitor visitor : visitors) {
            try {
                visitor.leaveNode(ctx);
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }
}
