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
package net.boyechko.probcheck.ui;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The final checklist of findings. Keys are grouped into sections by problem, and every finding
 * becomes an unchecked Markdown task:
 *
 * <pre>
 * * hello
 *     * [ ] hello: has no TLE submissions
 *     * [ ] hello/problem_statement/problem.tex: misspelled words: ['wrold']
 * </pre>
 */
public class IssueReport {
    private static final Logger logger = LoggerFactory.getLogger(IssueReport.class);

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final IssueLog log;

    public IssueReport(IssueLog log) {
        this.log = log;
    }

    /** {@code problem-check-log-YYYYMMDD-HHMMSS[-hash].txt} */
    public static String logFileName(LocalDateTime now, String gitHash) {
        String suffix = gitHash.isEmpty() ? "" : "-" + gitHash;
        return "problem-check-log-" + TIMESTAMP.format(now) + suffix + ".txt";
    }

    /** The short hash of HEAD in {@code workingDir}, or an empty string outside a repository. */
    public static String gitHash(Path workingDir) {
        ProcessBuilder pb =
                new ProcessBuilder("git", "rev-parse", "--short", "HEAD")
                        .directory(workingDir.toFile())
                        .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = pb.start();
            String out;
            try (InputStream stdout = process.getInputStream()) {
                out = new String(stdout.readAllBytes(), StandardCharsets.UTF_8).strip();
            }
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroy();
                return "";
            }
            return process.exitValue() == 0 ? out : "";
        } catch (IOException e) {
            logger.debug("Could not run git: {}", e.getMessage());
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        }
    }

    public List<String> render(String logFileName, Path workingDir, String gitHash) {
        List<String> lines = new ArrayList<>();
        lines.add(
                "logfile is "
                        + logFileName
                        + ", working directory is "
                        + workingDir
                        + ", git hash is \""
                        + gitHash
                        + "\"");
        lines.add("");

        String lastPrefix = null;
        for (String key : log.allKeys()) {
            String prefix = IssueLoc.fromKey(key).prefix();
            if (!prefix.equals(lastPrefix)) {
                lastPrefix = prefix;
                lines.add("");
                lines.add("* " + prefix);
            }
            for (Issue issue : log.issuesFor(key)) {
                lines.add("    * [ ] " + key + ": " + issue.message());
            }
        }
        return lines;
    }

    /**
     * Prints the report to {@code out} and saves a copy in {@code logDir}.
     *
     * @return the file written
     */
    public Path write(Path logDir, PrintStream out, Path workingDir, String gitHash)
            throws IOException {
        String fileName = logFileName(LocalDateTime.now(), gitHash);
        Path file = logDir.resolve(fileName);
        if (!Files.isDirectory(logDir)) {
            Files.createDirectories(logDir);
        }

        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (String line : render(fileName, workingDir, gitHash)) {
                out.println(line);
                writer.write(line);
                writer.newLine();
            }
        }
        logger.info("Wrote report to {}", file);
        return file;
    }
}
