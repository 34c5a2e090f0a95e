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
package net.boyechko.probcheck.document;

import java.util.List;

/**
 * Node of a parsed statement. The variant is closed and carries an explicit {@link Kind} so that
 * tree consumers dispatch on the tag rather than on the runtime class.
 */
public sealed interface DocNode
        permits DocNode.Text, DocNode.Group, DocNode.MathEnvironment, DocNode.Generic {

    enum Kind {
        /** Literal text payload. */
        TEXT,
        /** A brace-delimited scope. */
        GROUP,
        /** A scope whose whole subtree is mathematical content. */
        MATH_ENVIRONMENT,
        /** Any other command or environment. */
        GENERIC
    }

    Kind kind();

    String name();

    List<DocNode> children();

    record Text(String text) implements DocNode {
        public Text {
            if (text == null) {
                throw new IllegalArgumentException("Text payload is required");
            }
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public String name() {
            return "#text";
        }

        @Override
        public List<DocNode> children() {
            return List.of();
        }
    }

    record Group(List<DocNode> children) implements DocNode {
        public Group {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.GROUP;
        }

        @Override
        public String name() {
            return "bgroup";
        }
    }

    record MathEnvironment(String name, List<DocNode> children) implements DocNode {
        public MathEnvironment {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.MATH_ENVIRONMENT;
        }
    }

    record Generic(String name, List<DocNode> children) implements DocNode {
        public Generic {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.GENERIC;
        }
    }

    static DocNode text(String text) {
        return new Text(text);
    }

    static DocNode group(DocNode... children) {
        return new Group(List.of(children));
    }

    static DocNode math(DocNode... children) {
        return new MathEnvironment("math", List.of(children));
    }

    static DocNode generic(String name, DocNode... children) {
        return new Generic(name, List.of(children));
    }
}
