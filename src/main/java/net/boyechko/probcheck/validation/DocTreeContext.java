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

import net.boyechko.probcheck.document.DocNode;

/**
 * Immutable context passed to visitors during document tree traversal. Math mode is computed by
 * the walker and handed down by value: once a node is inside a math environment, so are all of
 * its descendants.
 */
public record DocTreeContext(
        DocNode node,
        /** True if an ancestor of this node is a math environment. */
        boolean inMath,
        String path,
        /** Depth in the tree (0 = document root). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex) {

    public DocNode.Kind kind() {
        return node.kind();
    }

    public boolean is(DocNode.Kind kind) {
        return node.kind() == kind;
    }

    /** Returns whether this node's children are in math mode. */
    public boolean childrenInMath() {
        return inMath || node.kind() == DocNode.Kind.MATH_ENVIRONMENT;
    }
}
