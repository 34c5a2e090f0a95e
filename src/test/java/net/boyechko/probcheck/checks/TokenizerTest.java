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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TokenizerTest {

    @Test
    void trimsPunctuationAtWordEdges() {
        assertEquals(
                List.of("hello", "world", "don't", "x-ray", "3.14"),
                List.copyOf(Tokenizer.tokens("(hello, world!) don't \"x-ray\" 3.14.")));
    }

    @Test
    void keepsUnicodeLetters() {
        assertEquals(Set.of("smörgåsbord", "naïve"), Tokenizer.tokens("smörgåsbord naïve"));
    }

    @Test
    void tokensAreDistinct() {
        assertEquals(Set.of("a", "b"), Tokenizer.tokens("a b a b a"));
    }

    @Test
    void retokenizingJoinedTokensIsStable() {
        String text = "the (quick) brown-fox, 12,345 jumps... over 3.5 \"lazy\" dogs' tails";
        Set<String> once = Tokenizer.tokens(text);
        Set<String> twice = Tokenizer.tokens(String.join(" ", once));
        assertEquals(once, twice);
    }

    @Test
    void punctuationOnlyHasNoTokens() {
        assertTrue(Tokenizer.tokens(" -- ... ?! ").isEmpty());
    }
}
