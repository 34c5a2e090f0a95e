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
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import net.boyechko.probcheck.checks.MetadataConsistencyCheck;
import net.boyechko.probcheck.checks.NameUniquenessCheck;
import net.boyechko.probcheck.dictionary.SpellingDictionaries;
import net.boyechko.probcheck.document.DocNode;
import net.boyechko.probcheck.document.MarkupParseException;
import net.boyechko.probcheck.document.MarkupParser;
import net.boyechko.probcheck.document.TextStreams;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueLog;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.metadata.MetadataSchema;
import net.boyechko.probcheck.metadata.ProblemMetadata;
import net.boyechko.probcheck.validation.DocTreeWalker;
import net.boyechko.probcheck.validation.ProblemCheck;
import net.boyechko.probcheck.visitors.TextClassifier;
import net.boyechko.probcheck.visitors.TreeDumpVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates checking a set of problem packages. */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final ProcessingListener listener;
    private final Collaborator<MarkupParser> parser;
    private final Collaborator<MetadataSchema> schema;
    private final Collaborator<SpellingDictionaries> dictionaries;
    private final CheckerOptions options;
    private final List<ProblemCheck> checks;
    private final NameUniquenessCheck nameCheck;
    private final MetadataConsistencyCheck consistencyCheck;

    public static class ProcessingServiceBuilder {
        private ProcessingListener listener;
        private Collaborator<MarkupParser> parser;
        private Collaborator<MetadataSchema> schema;
        private Collaborator<SpellingDictionaries> dictionaries;
        private CheckerOptions options = CheckerOptions.defaults();
        private Path problemNameCache;

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public ProcessingServiceBuilder withParser(Collaborator<MarkupParser> parser) {
            this.parser = parser;
            return this;
        }

        public ProcessingServiceBuilder withSchema(Collaborator<MetadataSchema> schema) {
            this.schema = schema;
            return this;
        }

        public ProcessingServiceBuilder withDictionaries(
                Collaborator<SpellingDictionaries> dictionaries) {
            this.dictionaries = dictionaries;
            return this;
        }

        public ProcessingServiceBuilder withOptions(CheckerOptions options) {
            this.options = options;
            return this;
        }

        public ProcessingServiceBuilder withProblemNameCache(Path problemNameCache) {
            this.problemNameCache = problemNameCache;
            return this;
        }

        public ProcessingService build() {
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before"
                                + " building ProcessingService");
            }
            if (parser == null) {
                parser = ProcessingDefaults.parser();
            }
            if (schema == null) {
                schema = ProcessingDefaults.schema(Optional.empty());
            }
            if (dictionaries == null) {
                dictionaries = ProcessingDefaults.noDictionaries();
            }
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.listener = builder.listener;
        this.parser = builder.parser;
        this.schema = builder.schema;
        this.dictionaries = builder.dictionaries;
        this.options = builder.options;
        this.checks = ProcessingDefaults.problemChecks(options);
        this.nameCheck = new NameUniquenessCheck(Optional.ofNullable(builder.problemNameCache));
        this.consistencyCheck = new MetadataConsistencyCheck();
    }

    /**
     * Checks every problem and then compares the problems with each other. A problem whose checks
     * throw is reported and left out of the cross-problem comparison; the run carries on with the
     * next one.
     */
    public IssueLog checkProblems(List<Path> problemDirs) {
        IssueLog log = new IssueLog();
        List<String> names = problemDirs.stream().map(ProblemContext::problemName).toList();

        if (!dictionaries.isAvailable()) {
            Issue unavailable =
                    new Issue(
                            IssueType.COLLABORATOR_UNAVAILABLE,
                            IssueSev.ERROR,
                            IssueLoc.general(),
                            dictionaries.unavailableMessage());
            log.log(unavailable);
            listener.onError(unavailable.message());
        }
        SpellingDictionaries words =
                dictionaries.isAvailable() ? dictionaries.get() : SpellingDictionaries.empty();

        listener.onPhaseStart(nameCheck.name());
        report(log, nameCheck.findIssues(names), nameCheck.name());

        Map<String, ProblemMetadata> checkedMetadata = new LinkedHashMap<>();
        for (Path dir : problemDirs) {
            ProblemContext ctx = new ProblemContext(dir, parser, schema, words, options);
            listener.onPhaseStart(ctx.name());
            try {
                for (ProblemCheck check : checks) {
                    report(log, check.findIssues(ctx), check.passedMessage());
                }
                checkedMetadata.put(ctx.name(), ctx.metadata());
            } catch (Exception e) {
                logger.debug("Checking {} failed", ctx.name(), e);
                Issue failure =
                        new Issue(
                                IssueType.PROBLEM_CHECK_FAILED,
                                IssueSev.ERROR,
                                ctx.where(),
                                "an exception occurred when checking this problem: "
                                        + stackTraceOf(e));
                log.log(failure);
                listener.onError(ctx.name() + ": " + e);
            }
        }

        listener.onPhaseStart(consistencyCheck.name());
        report(
                log,
                consistencyCheck.findIssues(checkedMetadata, schema),
                consistencyCheck.name() + ": no issues");

        listener.onSummary(log);
        return log;
    }

    /**
     * Prints the classified document tree of one statement file and the two text streams it
     * yields.
     */
    public TextStreams dumpTree(Path texFile) throws IOException, MarkupParseException {
        DocNode root = parser.get().parse(texFile);
        TextClassifier classifier = new TextClassifier();
        new DocTreeWalker()
                .addVisitor(new TreeDumpVisitor(listener::onVerboseOutput))
                .addVisitor(classifier)
                .walk(root);
        TextStreams streams = classifier.streams();
        listener.onVerboseOutput(String.format("%nplain text: %s%n", streams.plainText()));
        listener.onVerboseOutput(String.format("math text:  %s%n", streams.mathText()));
        return streams;
    }

    private void report(IssueLog log, IssueList issues, String passedMessage) {
        log.logAll(issues);
        if (issues.isEmpty()) {
            listener.onSuccess(passedMessage);
            return;
        }
        reportIssuesGrouped(issues);
    }

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Issue::type, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();

            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }

    private static String stackTraceOf(Throwable t) {
        StringWriter trace = new StringWriter();
        t.printStackTrace(new PrintWriter(trace));
        return trace.toString();
    }

    public List<ProblemCheck> getChecks() {
        return new ArrayList<>(checks);
    }
}
