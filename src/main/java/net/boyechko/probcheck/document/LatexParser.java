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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the subset of LaTeX found in problem statements into a {@link DocNode} tree.
 *
 * <p>Brace groups become {@link DocNode.Group}s; {@code $..$}, {@code $$..$$}, {@code \(..\)},
 * {@code \[..\]} and the math environments become {@link DocNode.MathEnvironment}s; every other
 * command or environment becomes a {@link DocNode.Generic}. Comments are dropped. Arguments that
 * never hold prose (file names, labels, URLs, column specs) are consumed without producing text,
 * and spacing commands such as {@code \,} produce a single space.
 */
public class LatexParser implements MarkupParser {
    private static final Logger logger = LoggerFactory.getLogger(LatexParser.class);

    private static final Set<String> MATH_ENVIRONMENTS =
            Set.of(
                    "math",
                    "displaymath",
                    "equation",
                    "equation*",
                    "align",
                    "align*",
                    "alignat",
                    "alignat*",
                    "eqnarray",
                    "eqnarray*",
                    "gather",
                    "gather*",
                    "multline",
                    "multline*",
                    "flalign",
                    "flalign*");

    /** Commands whose leading mandatory arguments are not prose, with the number to discard. */
    private static final Map<String, Integer> OPAQUE_COMMANDS =
            Map.ofEntries(
                    Map.entry("includegraphics", 1),
                    Map.entry("illustration", 2),
                    Map.entry("label", 1),
                    Map.entry("ref", 1),
                    Map.entry("eqref", 1),
                    Map.entry("cite", 1),
                    Map.entry("url", 1),
                    Map.entry("href", 1),
                    Map.entry("input", 1),
                    Map.entry("include", 1),
                    Map.entry("hspace", 1),
                    Map.entry("vspace", 1),
                    Map.entry("documentclass", 1),
                    Map.entry("usepackage", 1),
                    Map.entry("newcommand", 2),
                    Map.entry("renewcommand", 2),
                    Map.entry("setlength", 2),
                    Map.entry("color", 1));

    /** Environments whose leading arguments are not prose. */
    private static final Map<String, Integer> OPAQUE_ENVIRONMENT_ARGS =
            Map.of(
                    "tabular", 1,
                    "tabular*", 2,
                    "tabularx", 2,
                    "array", 1,
                    "minipage", 1,
                    "wrapfigure", 2,
                    "alignat", 1,
                    "alignat*", 1);

    /** Commands whose mandatory arguments hold prose and become the node's children. */
    private static final Map<String, Integer> TEXT_COMMANDS =
            Map.ofEntries(
                    Map.entry("textbf", 1),
                    Map.entry("textit", 1),
                    Map.entry("textsl", 1),
                    Map.entry("texttt", 1),
                    Map.entry("textsc", 1),
                    Map.entry("textrm", 1),
                    Map.entry("textsf", 1),
                    Map.entry("emph", 1),
                    Map.entry("underline", 1),
                    Map.entry("section", 1),
                    Map.entry("section*", 1),
                    Map.entry("subsection", 1),
                    Map.entry("subsection*", 1),
                    Map.entry("paragraph", 1),
                    Map.entry("problemname", 1),
                    Map.entry("caption", 1),
                    Map.entry("footnote", 1),
                    Map.entry("text", 1),
                    Map.entry("mbox", 1),
                    Map.entry("mathrm", 1),
                    Map.entry("mathit", 1),
                    Map.entry("mathbf", 1),
                    Map.entry("operatorname", 1));

    private static final Set<String> SPACING_COMMANDS =
            Set.of("quad", "qquad", "enspace", "thinspace", "medspace", "thickspace", "newline");

    private static final String ACCENTS = "'\"`^~=.";

    /** Groups, math and environments nested deeper than this are rejected. */
    static final int MAX_NESTING = 200;

    @Override
    public DocNode parse(String source) throws MarkupParseException {
        Reader reader = new Reader(source);
        List<DocNode> children = reader.parseUntil(Closer.endOfInput());
        logger.debug(
                "Parsed {} characters into {} top-level nodes", source.length(), children.size());
        return new DocNode.Generic("document", children);
    }

    /** What ends the sequence currently being read. */
    private record Closer(String literal, String description, int openedOnLine) {
        static Closer endOfInput() {
            return new Closer(null, "document", 1);
        }

        static Closer brace(int line) {
            return new Closer("}", "group", line);
        }

        static Closer literal(String literal, int line) {
            return new Closer(literal, "math '" + literal + "'", line);
        }

        static Closer environment(String name, int line) {
            return new Closer("\\end{" + name + "}", "environment " + name, line);
        }

        boolean isEndOfInput() {
            return literal == null;
        }
    }

    /** Single-use cursor over one source text. */
    private static final class Reader {
        private final String src;
        private int pos;
        private int line = 1;
        private int depth;

        Reader(String src) {
            this.src = src;
        }

        List<DocNode> parseUntil(Closer closer) throws MarkupParseException {
            if (depth >= MAX_NESTING) {
                throw new MarkupParseException("nesting too deep", line);
            }
            depth++;
            try {
                return readSequence(closer);
            } finally {
                depth--;
            }
        }

        private List<DocNode> readSequence(Closer closer) throws MarkupParseException {
            List<DocNode> nodes = new ArrayList<>();
            StringBuilder text = new StringBuilder();
            while (true) {
                if (atEnd()) {
                    if (closer.isEndOfInput()) {
                        flush(nodes, text);
                        return nodes;
                    }
                    throw new MarkupParseException(
                            "unterminated "
                                    + closer.description()
                                    + " opened on line "
                                    + closer.openedOnLine(),
                            line);
                }
                if (!closer.isEndOfInput() && src.startsWith(closer.literal(), pos)) {
                    advance(closer.literal().length());
                    flush(nodes, text);
                    return nodes;
                }

                char c = src.charAt(pos);
                switch (c) {
                    case '%' -> skipComment();
                    case '{' -> {
                        flush(nodes, text);
                        int opened = line;
                        advance(1);
                        nodes.add(new DocNode.Group(parseUntil(Closer.brace(opened))));
                    }
                    case '}' -> throw new MarkupParseException("unbalanced '}'", line);
                    case '$' -> {
                        flush(nodes, text);
                        int opened = line;
                        if (src.startsWith("$$", pos)) {
                            advance(2);
                            nodes.add(
                                    new DocNode.MathEnvironment(
                                            "displaymath",
                                            parseUntil(Closer.literal("$$", opened))));
                        } else {
                            advance(1);
                            nodes.add(
                                    new DocNode.MathEnvironment(
                                            "math", parseUntil(Closer.literal("$", opened))));
                        }
                    }
                    case '\\' -> {
                        flush(nodes, text);
                        readControlSequence(nodes);
                    }
                    case '~', '&' -> {
                        advance(1);
                        text.append(' ');
                    }
                    default -> {
                        advance(1);
                        text.append(c);
                    }
                }
            }
        }

        private void readControlSequence(List<DocNode> nodes) throws MarkupParseException {
            int opened = line;
            advance(1);
            if (atEnd()) {
                nodes.add(new DocNode.Text("\\"));
                return;
            }

            char c = src.charAt(pos);
            if (!Character.isLetter(c)) {
                advance(1);
                readControlSymbol(c, opened, nodes);
                return;
            }

            String name = readCommandName();
            skipSpaces();

            if ("begin".equals(name)) {
                readEnvironment(opened, nodes);
            } else if ("end".equals(name)) {
                String env = readBracedRaw();
                throw new MarkupParseException("\\end{" + env + "} without matching \\begin", line);
            } else if (SPACING_COMMANDS.contains(name)) {
                nodes.add(new DocNode.Text(" "));
            } else if (OPAQUE_COMMANDS.containsKey(name)) {
                skipArguments(OPAQUE_COMMANDS.get(name));
                nodes.add(new DocNode.Generic(name, List.of()));
            } else if (TEXT_COMMANDS.containsKey(name)) {
                skipOptionalArguments();
                nodes.add(new DocNode.Generic(name, readArguments(TEXT_COMMANDS.get(name))));
            } else {
                nodes.add(new DocNode.Generic(name, List.of()));
            }
        }

        private void readControlSymbol(char c, int opened, List<DocNode> nodes)
                throws MarkupParseException {
            switch (c) {
                case '(' ->
                        nodes.add(
                                new DocNode.MathEnvironment(
                                        "math", parseUntil(Closer.literal("\\)", opened))));
                case '[' ->
                        nodes.add(
                                new DocNode.MathEnvironment(
                                        "displaymath", parseUntil(Closer.literal("\\]", opened))));
                case '\\' -> {
                    skipOptionalArguments();
                    nodes.add(new DocNode.Text(" "));
                }
                case ',', ';', ':', '!', ' ', '\n', '\t' -> nodes.add(new DocNode.Text(" "));
                case '%', '$', '&', '#', '_', '{', '}' ->
                        nodes.add(new DocNode.Text(String.valueOf(c)));
                default -> {
                    if (ACCENTS.indexOf(c) >= 0) {
                        nodes.add(new DocNode.Generic(String.valueOf(c), readArguments(1)));
                    } else {
                        nodes.add(new DocNode.Generic(String.valueOf(c), List.of()));
                    }
                }
            }
        }

        private void readEnvironment(int opened, List<DocNode> nodes) throws MarkupParseException {
            String env = readBracedRaw();
            skipOptionalArguments();
            Integer opaqueArgs = OPAQUE_ENVIRONMENT_ARGS.get(env);
            if (opaqueArgs != null) {
                skipArguments(opaqueArgs);
            }
            List<DocNode> children = parseUntil(Closer.environment(env, opened));
            if (MATH_ENVIRONMENTS.contains(env)) {
                nodes.add(new DocNode.MathEnvironment(env, children));
            } else {
                nodes.add(new DocNode.Generic(env, children));
            }
        }

        /** Reads {@code count} arguments; a non-brace argument is a single character. */
        private List<DocNode> readArguments(int count) throws MarkupParseException {
            List<DocNode> args = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                skipWhitespace();
                if (atEnd()) {
                    break;
                }
                char c = src.charAt(pos);
                if (c == '{') {
                    int opened = line;
                    advance(1);
                    args.add(new DocNode.Group(parseUntil(Closer.brace(opened))));
                } else if (c == '\\' || c == '}' || c == '$' || c == '%') {
                    break;
                } else {
                    advance(1);
                    args.add(new DocNode.Text(String.valueOf(c)));
                }
            }
            return args;
        }

        private void skipArguments(int count) throws MarkupParseException {
            skipOptionalArguments();
            for (int i = 0; i < count; i++) {
                skipWhitespace();
                if (atEnd() || src.charAt(pos) != '{') {
                    return;
                }
                readBracedRaw();
                skipOptionalArguments();
            }
        }

        private void skipOptionalArguments() throws MarkupParseException {
            while (true) {
                int mark = pos;
                int markLine = line;
                skipWhitespace();
                if (atEnd() || src.charAt(pos) != '[') {
                    pos = mark;
                    line = markLine;
                    return;
                }
                readDelimitedRaw('[', ']');
            }
        }

        private String readBracedRaw() throws MarkupParseException {
            skipWhitespace();
            if (atEnd() || src.charAt(pos) != '{') {
                throw new MarkupParseException("expected '{'", line);
            }
            return readDelimitedRaw('{', '}');
        }

        /** Reads a balanced delimited run without interpreting it, honoring escapes. */
        private String readDelimitedRaw(char open, char close) throws MarkupParseException {
            int opened = line;
            advance(1);
            int start = pos;
            int depth = 1;
            while (!atEnd()) {
                char c = src.charAt(pos);
                if (c == '\\' && pos + 1 < src.length()) {
                    advance(2);
                    continue;
                }
                if (c == open) {
                    depth++;
                } else if (c == close && --depth == 0) {
                    String raw = src.substring(start, pos);
                    advance(1);
                    return raw;
                }
                advance(1);
            }
            throw new MarkupParseException(
                    "unterminated '" + open + "' opened on line " + opened, line);
        }

        private String readCommandName() {
            int start = pos;
            while (!atEnd() && Character.isLetter(src.charAt(pos))) {
                advance(1);
            }
            if (!atEnd() && src.charAt(pos) == '*') {
                advance(1);
            }
            return src.substring(start, pos);
        }

        private void skipComment() {
            while (!atEnd() && src.charAt(pos) != '\n') {
                advance(1);
            }
            if (!atEnd()) {
                advance(1);
            }
            skipSpaces();
        }

        private void skipSpaces() {
            while (!atEnd() && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
                advance(1);
            }
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(src.charAt(pos))) {
                advance(1);
            }
        }

        private void advance(int n) {
            for (int i = 0; i < n && pos < src.length(); i++) {
                if (src.charAt(pos) == '\n') {
                    line++;
                }
                pos++;
            }
        }

        private boolean atEnd() {
            return pos >= src.length();
        }

        private static void flush(List<DocNode> nodes, StringBuilder text) {
            if (text.length() > 0) {
                nodes.add(new DocNode.Text(text.toString()));
                text.setLength(0);
            }
        }
    }
}
