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
package net.boyechko.probcheck.ui.cli;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.probcheck.core.CheckerOptions;
import net.boyechko.probcheck.core.Collaborator;
import net.boyechko.probcheck.core.ProblemDiscovery;
import net.boyechko.probcheck.core.ProcessingDefaults;
import net.boyechko.probcheck.core.ProcessingService;
import net.boyechko.probcheck.core.VerbosityLevel;
import net.boyechko.probcheck.dictionary.SpellingDictionaries;
import net.boyechko.probcheck.document.MarkupParseException;
import net.boyechko.probcheck.issue.IssueLog;
import net.boyechko.probcheck.ui.IssueReport;
import net.boyechko.probcheck.ui.ProcessingReporter;
import net.boyechko.probcheck.validation.ProblemCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProblemCheckCLI {
    static final Path DEFAULT_DICTIONARIES =
            Paths.get(System.getProperty("user.home"), "etc", "dictionaries");

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            List<Path> problems,
            Path problemNameCache,
            Path dictionaries,
            Path defaultsFile,
            boolean allowDefaultValues,
            boolean checkFutureTense,
            Path logDir,
            Path dumpTree,
            VerbosityLevel verbosity) {
        public CLIConfig {
            problems = List.copyOf(problems);
            if (dictionaries == null) {
                throw new IllegalArgumentException("Dictionary directory is required");
            }
            if (logDir == null) {
                throw new IllegalArgumentException("Log directory is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }

        public CheckerOptions checkerOptions() {
            return new CheckerOptions(!allowDefaultValues, checkFutureTense);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        List<Path> problems = new ArrayList<>();
        Path problemNameCache;
        Path dictionaries = DEFAULT_DICTIONARIES;
        Path defaultsFile;
        boolean allowDefaultValues;
        boolean checkFutureTense;
        Path logDir = Paths.get(".");
        Path dumpTree;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            for (Path problem : problems) {
                if (!Files.isDirectory(problem)) {
                    throw new CLIException("Problem directory not found: " + problem);
                }
            }
            if (problemNameCache != null && !Files.isRegularFile(problemNameCache)) {
                throw new CLIException("Problem name cache not found: " + problemNameCache);
            }
            if (defaultsFile != null && !Files.isRegularFile(defaultsFile)) {
                throw new CLIException("Defaults file not found: " + defaultsFile);
            }
            if (dumpTree != null && !Files.isRegularFile(dumpTree)) {
                throw new CLIException("File not found: " + dumpTree);
            }

            return new CLIConfig(
                    problems,
                    problemNameCache,
                    dictionaries,
                    defaultsFile,
                    allowDefaultValues,
                    checkFutureTense,
                    logDir,
                    dumpTree,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs the command line and returns the process exit status. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            if (config.dumpTree() != null) {
                return dumpTree(config, out, err);
            }
            return checkProblems(config, out, err);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                applyOption(b, arg.substring(0, eq), arg.substring(eq + 1));
                continue;
            }
            switch (arg) {
                case "--problem-name-cache", "--dictionaries", "--defaults", "--log-dir",
                        "--dump-tree" -> {
                    if (i + 1 < args.length) {
                        applyOption(b, arg, args[++i]);
                    } else {
                        throw new CLIException("Value not specified after " + arg);
                    }
                }
                case "--allow-default-values" -> b.allowDefaultValues = true;
                case "--check-future-tense" -> b.checkFutureTense = true;
                case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                default -> {
                    if (arg.startsWith("-")) {
                        throw new CLIException("Unknown option: " + arg);
                    }
                    b.problems.add(Paths.get(arg));
                }
            }
        }

        return b.build();
    }

    private static void applyOption(CLIConfigBuilder b, String option, String value)
            throws CLIException {
        if (value.isEmpty()) {
            throw new CLIException("Value not specified after " + option);
        }
        switch (option) {
            case "--problem-name-cache" -> b.problemNameCache = Paths.get(value);
            case "--dictionaries" -> b.dictionaries = Paths.get(value);
            case "--defaults" -> b.defaultsFile = Paths.get(value);
            case "--log-dir" -> b.logDir = Paths.get(value);
            case "--dump-tree" -> b.dumpTree = Paths.get(value);
            default -> throw new CLIException("Unknown option: " + option);
        }
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(ProblemCheckCLI.class);
        }
        return logger;
    }

    private static int checkProblems(CLIConfig config, PrintStream out, PrintStream err) {
        ProcessingReporter reporter = new ProcessingReporter(out, config.verbosity());
        try {
            Collaborator<SpellingDictionaries> dictionaries =
                    ProcessingDefaults.dictionaries(config.dictionaries());
            List<Path> problems = config.problems();
            if (problems.isEmpty()) {
                problems = ProblemDiscovery.find(Paths.get(""));
            }
            logger().info("Checking {} problem(s)", problems.size());

            ProcessingService service =
                    new ProcessingService.ProcessingServiceBuilder()
                            .withListener(reporter)
                            .withParser(ProcessingDefaults.parser())
                            .withSchema(
                                    ProcessingDefaults.schema(
                                            Optional.ofNullable(config.defaultsFile())))
                            .withDictionaries(dictionaries)
                            .withOptions(config.checkerOptions())
                            .withProblemNameCache(config.problemNameCache())
                            .build();
            if (reporter.shouldShow(VerbosityLevel.VERBOSE)) {
                for (ProblemCheck check : service.getChecks()) {
                    reporter.onInfo("Enabled: " + check.name());
                }
            }

            IssueLog log = service.checkProblems(problems);
            reporter.finish();

            Path workingDir = Paths.get("").toAbsolutePath();
            new IssueReport(log)
                    .write(config.logDir(), out, workingDir, IssueReport.gitHash(workingDir));
            return 0;
        } catch (IOException e) {
            err.println("✗ Checking failed: " + e.getMessage());
            logger().debug("Checking failed", e);
            return 1;
        }
    }

    /** Prints the classified document tree of one statement file. */
    private static int dumpTree(CLIConfig config, PrintStream out, PrintStream err) {
        ProcessingReporter reporter = new ProcessingReporter(out, config.verbosity());
        ProcessingService service =
                new ProcessingService.ProcessingServiceBuilder().withListener(reporter).build();
        try {
            service.dumpTree(config.dumpTree());
            return 0;
        } catch (IOException | MarkupParseException e) {
            err.println("✗ Failed to parse " + config.dumpTree() + ": " + e.getMessage());
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java ProblemCheckCLI [options] [<problem> ...]\n"
                + "Checks problem packages (directories with a problem.yaml). Without arguments,\n"
                + "checks every problem package in the working directory.\n"
                + "  -h, --help                   Show this help message\n"
                + "  -q, --quiet                  Only show errors and the final report\n"
                + "  -v, --verbose                Show every finding and passed check\n"
                + "  -vv, --debug                 Show all debug information\n"
                + "  --problem-name-cache <file>  Names already in use, one per line\n"
                + "  --dictionaries <dir>         Spelling dictionaries, one directory per\n"
                + "                               language (default: ~/etc/dictionaries)\n"
                + "  --defaults <file>            Metadata defaults YAML to check against\n"
                + "  --allow-default-values       Do not flag metadata set to its default\n"
                + "  --check-future-tense         Flag statements using \"will\"\n"
                + "  --log-dir <dir>              Where to save the report (default: .)\n"
                + "  --dump-tree <file.tex>       Print how a statement is classified and exit\n"
                + "Examples:\n"
                + "  java ProblemCheckCLI\n"
                + "  java ProblemCheckCLI --problem-name-cache names.txt hello different\n"
                + "  java ProblemCheckCLI --dump-tree hello/problem_statement/problem.tex";
    }
}
