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
import static net.boyechko.probcheck.document.DocNode.group;
import static net.boyechko.probcheck.document.DocNode.math;
import static net.boyechko.probcheck.document.DocNode.text;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import net.boyechko.probcheck.checks.Tokenizer;
import net.boyechko.probcheck.document.DocNode;
import net.boyechko.probcheck.document.TextStreams;
import org.junit.jupiter.api.Test;

class TextClassifierTest {

    @Test
    void everythingBelowMathIsMath() {
        DocNode root =
                generic(
                        "document",
                        text("Prose "),
                        math(
                                text("X"),
                                group(generic("frac", group(text("Deep")), group(text("Er"))))));

        TextStreams streams = TextClassifier.classify(root);

        assertEquals("prose", streams.plainText().strip(), "Only prose outside math is plain");
        assertTrue(streams.mathText().contains("x"));
        assertTrue(streams.mathText().contains("deep"));
        assertTrue(streams.mathText().contains("er"));
    }

    @Test
    void adjacentGroupsDoNotFuse() {
        DocNode root = generic("document", group(text("foo")), group(text("bar")));

        TextStreams streams = TextClassifier.classify(root);

        assertEquals(Set.of("foo", "bar"), Tokenizer.tokens(streams.plainText()));
    }

    @Test
    void groupAddsSeparatorToBothStreams() {
        TextStreams streams = TextClassifier.classify(group(text("a")));
        assertEquals(" a", streams.plainText());
        assertEquals(" ", streams.mathText());
    }

    @Test
    void mathEnvironmentAddsSeparatorOnlyToMath() {
        TextStreams streams = TextClassifier.classify(generic("document", math(text("1"))));
        assertEquals("", streams.plainText());
        assertEquals(" 1", streams.mathText());
    }

    @Test
    void genericNamesAreNotText() {
        TextStreams streams =
                TextClassifier.classify(
                        generic("document", generic("textbf", group(text("Bold"))), text("x")));
        assertEquals(" boldx", streams.plainText(), "Generic nodes add no separator");
        assertFalse(streams.plainText().contains("textbf"));
    }

    @Test
    void textIsLowercased() {
        TextStreams streams = TextClassifier.classify(generic("document", text("ÄBC Def")));
        assertEquals("äbc def", streams.plainText());
    }
}
