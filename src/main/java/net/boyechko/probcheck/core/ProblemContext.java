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
package net.boyechko.probcheck.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import net.boyechko.probcheck.dictionary.SpellingDictionaries;
import net.boyechko.probcheck.document.MarkupParser;
import net.boyechko.probcheck.document.StatementFile;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.metadata.MetadataSchema;
import net.boyechko.probcheck.metadata.ProblemMetadata;
import net.boyechko.probcheck.submissions.SubmissionInventory;

/**
 * Everything the checks of one problem package need. The package's metadata and submissions are
 * read on first use and shared by all checks.
 */
public final class ProblemContext {
    public static final String STATEMENT_DIRECTORY = "problem_statement";

    private final Path directory;
    private final String name;
    private final Collaborator<MarkupParser> parser;
    private final Collaborator<MetadataSchema> schema;
    private final SpellingDictionaries dictionaries;
    private final CheckerOptions options;

    private ProblemMetadata metadata;
    private SubmissionInventory submissions;

    public ProblemContext(
            Path directory,
            Collaborator<MarkupParser> parser,
            Collaborator<MetadataSchema> schema,
            SpellingDictionaries dictionaries,
            CheckerOptions options) {
        this.directory = directory;
        this.name = problemName(directory);
        this.parser = parser;
        this.schema = schema;
        this.dictionaries = dictionaries;
        this.options = options;
    }

    /** A problem is named after its package directory. */
    public static String problemName(Path directory) {
        Path fileName = directory.getFileName();
        if (fileName == null || fileName.toString().equals(".")) {
            fileName = directory.toAbsolutePath().normalize().getFileName();
        }
        return fileName != null ? fileName.toString() : directory.toString();
    }

    public String name() {
        return name;
    }

    public Path directory() {
        return directory;
    }

    public Collaborator<MarkupParser> parser() {
        return parser;
    }

    public Collaborator<MetadataSchema> schema() {
        return schema;
    }

    public SpellingDictionaries dictionaries() {
        return dictionaries;
    }

    public CheckerOptions options() {
        return options;
    }

    public IssueLoc where() {
        return IssueLoc.atProblem(name);
    }

    public IssueLoc locate(Path file) {
        return IssueLoc.atFile(name, directory, file);
    }

    public IssueLoc metadataLocation() {
        return IssueLoc.atFile(name + "/" + ProblemMetadata.FILE_NAME);
    }

    public Path statementDirectory() {
        return directory.resolve(STATEMENT_DIRECTORY);
    }

    public ProblemMetadata metadata() throws IOException {
        if (metadata == null) {
            metadata = ProblemMetadata.load(directory);
        }
        return metadata;
    }

    public SubmissionInventory submissions() throws IOException {
        if (submissions == null) {
            submissions = SubmissionInventory.scan(directory);
        }
        return submissions;
    }

    /** Statement sources in the statement directory, sorted by file name. */
    public List<Path> statementFiles() throws IOException {
        return listStatementDirectory().stream()
                .filter(p -> StatementFile.languageOf(p).isPresent())
                .toList();
    }

    /** Regular files directly in the statement directory, sorted; empty if there is none. */
    public List<Path> listStatementDirectory() throws IOException {
        Path dir = statementDirectory();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile).sorted().toList();
        }
    }
}
