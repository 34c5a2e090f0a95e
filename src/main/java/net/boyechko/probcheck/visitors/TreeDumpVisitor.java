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

import java.util.function.Consumer;
import net.boyechko.probcheck.document.DocNode;
import net.boyechko.probcheck.validation.DocTreeContext;
import net.boyechko.probcheck.validation.DocTreeVisitor;

/** Outputs a tabular listing of the document tree during traversal. */
public class TreeDumpVisitor implements DocTreeVisitor {

    private static final String INDENT = "  ";
    private static final int INDEX_WIDTH = 5;
    private static final int NODE_NAME_WIDTH = 30;
    private static final int MODE_WIDTH = 6;
    private static final int CONTENT_SUMMARY_WIDTH = 30;

    private static final String ROW_FORMAT =
            String.format("%%-%ds %%-%ds %%-%ds %%s%%n", INDEX_WIDTH, NODE_NAME_WIDTH, MODE_WIDTH);

    private final Consumer<String> output;
    private boolean headerPrinted = false;

    public TreeDumpVisitor(Consumer<String> output) {
        this.output = output;
    }

    @Override
    public String name() {
        return "Document Tree Dump";
    }

    @Override
    public String description() {
        return "Outputs a tabular listing of the document tree during traversal";
    }

    @Override
    public void beforeTraversal() {
        printHeader();
    }

    @Override
    public boolean enterNode(DocTreeContext ctx) {
        if (!headerPrinted) {
            printHeader();
        }

        // Whitespace-only text is noise in the listing.
        if (ctx.is(DocNode.Kind.TEXT) && ((DocNode.Text) ctx.node()).text().isBlank()) {
            return true;
        }

        printNode(ctx);
        return true;
    }

    private void printHeader() {
        if (headerPrinted) return;
        headerPrinted = true;

        output.accept(String.format(ROW_FORMAT, "Index", "Node", "Mode", "Content"));
        output.accept(
                String.format(
                        ROW_FORMAT,
                        "-".repeat(INDEX_WIDTH),
                        "-".repeat(NODE_NAME_WIDTH),
                        "-".repeat(MODE_WIDTH),
                        "-".repeat(CONTENT_SUMMARY_WIDTH)));
    }

    private void printNode(DocTreeContext ctx) {
        String paddedIndex = String.format("%" + INDEX_WIDTH + "d", ctx.globalIndex());
        String nodeName = INDENT.repeat(ctx.depth()) + "- " + ctx.node().name();
        String mode = ctx.inMath() ? "math" : "text";

        String summary = "";
        if (ctx.node() instanceof DocNode.Text text) {
            summary = summarize(text.text());
        }

        output.accept(String.format(ROW_FORMAT, paddedIndex, nodeName, mode, summary));
    }

    private static String summarize(String text) {
        String oneLine = text.strip().replaceAll("\\s+", " ");
        if (oneLine.length() <= CONTENT_SUMMARY_WIDTH) {
            return "\"" + oneLine + "\"";
        }
        return "\"" + oneLine.substring(0, CONTENT_SUMMARY_WIDTH - 3) + "...\"";
    }
}
