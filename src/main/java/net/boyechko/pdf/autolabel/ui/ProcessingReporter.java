/*
 * PDF-Auto-Label - Automated label numbering for tagged documents
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
package net.boyechko.pdf.autolabel.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autolabel.core.ProcessingListener;
import net.boyechko.pdf.autolabel.core.ProcessingResult;
import net.boyechko.pdf.autolabel.core.VerbosityLevel;
import net.boyechko.pdf.autolabel.issue.Issue;
import net.boyechko.pdf.autolabel.issue.IssueList;
import net.boyechko.pdf.autolabel.issue.IssueSev;
import org.slf4j.LoggerFactory;

/** Prints labelling progress to the terminal inside box-drawn sections. */
public class ProcessingReporter implements ProcessingListener {
    static final String APP_LOGGER = "net.boyechko.pdf.autolabel";

    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "️✗";
    private static final String INFO = "○";
    private static final String LABEL = "→";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ProcessingReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger(APP_LOGGER);
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    /** Detaches the log buffer from the application logger. */
    public void close() {
        closePhaseBoxIfOpen();
        Logger appLogger = (Logger) LoggerFactory.getLogger(APP_LOGGER);
        appLogger.detachAppender(logBuffer);
        logBuffer.stop();
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onLabel(String where, String label) {
        printLine(where + " " + LABEL + " \"" + label + "\"", LABEL, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        if (issues.isEmpty()) return;

        String icon = iconFor(issues.get(0).severity());
        printLine(issues.size() + " " + groupLabel, icon);

        if (verbosity.shouldShow(VerbosityLevel.VERBOSE)) {
            for (Issue issue : issues) {
                printLine(issue.message() + issue.where().describe(), icon, VerbosityLevel.VERBOSE);
            }
        }
    }

    @Override
    public void onSummary(ProcessingResult result) {
        if (!verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            if (result.issues().hasErrors()) {
                for (Issue issue : result.issues().atLeast(IssueSev.ERROR)) {
                    printLine(issue.message(), ERROR, VerbosityLevel.QUIET);
                }
            }
            return;
        }
        closePhaseBoxIfOpen();
        printBoxHeader("Summary");

        if (result.isAborted()) {
            printLine("Nothing was labelled", ERROR);
        } else {
            printLine(
                    "Labelled "
                            + result.labelledElements()
                            + " of "
                            + result.labelableElements()
                            + " elements",
                    SUCCESS);
            if (result.outputFile() != null) {
                printLine(
                        "Wrote " + result.writtenElements() + " labels to " + result.outputFile(),
                        SUCCESS);
            } else {
                printLine("Dry run; no file written", INFO);
            }
        }

        IssueList issues = result.issues();
        if (!issues.isEmpty()) {
            long errors = issues.stream().filter(i -> i.severity() == IssueSev.ERROR).count();
            long warnings = issues.stream().filter(i -> i.severity() == IssueSev.WARNING).count();
            printLine(
                    "Issues: " + errors + " error(s), " + warnings + " warning(s), "
                            + (issues.size() - errors - warnings) + " note(s)",
                    errors > 0 ? ERROR : INFO);
        }
        printBoxFooter();
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onWarning(Issue issue) {
        printLine(issue.message() + issue.where().describe(), iconFor(issue.severity()));
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO);
    }

    @Override
    public void onVerboseOutput(String message) {
        if (verbosity.shouldShow(VerbosityLevel.VERBOSE)) {
            output.print(message);
        }
    }

    private static String iconFor(IssueSev severity) {
        return switch (severity) {
            case ERROR -> ERROR;
            case WARNING -> WARNING;
            case INFO -> INFO;
        };
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Flushes warnings and errors logged since the last drain into the open box. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        boolean first = true;
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)
                    && !verbosity.shouldShow(VerbosityLevel.DEBUG)) {
                continue;
            }
            if (first) {
                printEmptyLine();
                first = false;
            }
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            printLine("[" + event.getLevel() + "] " + event.getFormattedMessage(), icon);
        }
    }

    /**
     * Prints an indented line with the given icon, word-wrapping long messages to stay within the
     * box. Continuation lines align with the message start.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix.stripTrailing());
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    private void printEmptyLine() {
        output.println(INDENT.stripTrailing());
    }

    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
            if (currentLine.isEmpty()) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (!currentLine.isEmpty()) {
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
