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

import java.util.Locale;
import net.boyechko.probcheck.document.DocNode;
import net.boyechko.probcheck.document.TextStreams;
import net.boyechko.probcheck.validation.DocTreeContext;
import net.boyechko.probcheck.validation.DocTreeVisitor;
import net.boyechko.probcheck.validation.DocTreeWalker;

/**
 * Partitions the text of a document into prose and math streams. Text is lowercased. Every
 * group adds a space to both streams so that words of adjacent groups do not fuse, and every math
 * environment adds a space to the math stream. Other commands contribute nothing of their own.
 *
 * <p>Single-use: create a new instance per document.
 */
public class TextClassifier implements DocTreeVisitor {
    private final StringBuilder plainText = new StringBuilder();
    private final StringBuilder mathText = new StringBuilder();

    /** Classifies the text of the tree rooted at {@code root}. */
    public static TextStreams classify(DocNode root) {
        TextClassifier classifier = new TextClassifier();
        new DocTreeWalker().addVisitor(classifier).walk(root);
        return classifier.streams();
    }

    @Override
    public String name() {
        return "Text Classifier";
    }

    @Override
    public String description() {
        return "Splits document text into plain-text and math-mode streams";
    }

    @Override
    public boolean enterNode(DocTreeContext ctx) {
        switch (ctx.kind()) {
            case TEXT -> {
                String text = ((DocNode.Text) ctx.node()).text().toLowerCase(Locale.ROOT);
                (ctx.inMath() ? mathText : plainText).append(text);
            }
            case GROUP -> {
                plainText.append(' ');
                mathText.append(' ');
            }
            case MATH_ENVIRONMENT -> mathText.append(' ');
            case GENERIC -> {}
        }
        return true;
    }

    public TextStreams streams() {
        return new TextStreams(plainText.toString(), mathText.toString());
    }
}
