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
package net.boyechko.probcheck.visitors;

import static net.boyechko.probcheck.document.DocNode.generic;
import static net.boyechko.probcheck.document.DocNode.math;
import static net.boyechko.probcheck.document.DocNode.text;
import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.probcheck.validation.DocTreeWalker;
import org.junit.jupiter.api.Test;

class TreeDumpVisitorTest {

    @Test
    void listsNodesWithModeAndSkipsBlankText() {
        StringBuilder out = new StringBuilder();
        new DocTreeWalker()
                .addVisitor(new TreeDumpVisitor(out::append))
                .walk(generic("document", text("Sum "), text("  \n"), math(text("x+y"))));

        String dump = out.toString();
        String[] lines = dump.split("\n");
        assertTrue(lines[0].startsWith("Index"), "Header first: " + lines[0]);
        assertEquals(6, lines.length, "Header, rule and four non-blank nodes:\n" + dump);
        assertTrue(dump.contains("\"Sum\""));
        assertTrue(dump.matches("(?s).*- #text\\s+math\\s+\"x\\+y\".*"), dump);
    }
}
