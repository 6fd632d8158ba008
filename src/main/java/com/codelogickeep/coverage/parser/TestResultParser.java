package com.codelogickeep.coverage.parser;

import com.codelogickeep.coverage.model.TestExecutionSummary;
import com.codelogickeep.coverage.model.TestFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the console transcript of a test run into a {@link TestExecutionSummary}.
 * <p>
 * Two summary shapes are recognized:
 * <ul>
 *   <li>terminal line: {@code Total: 18, Passed: 15, Failed: 2, Skipped: 1 - 00:00:05.123}
 *       (also the newer {@code Failed! - Failed: 2, Passed: 15, Skipped: 1, Total: 18, Duration: 5 s} form)</li>
 *   <li>multi-line block: {@code Total tests: 18} followed by {@code Passed: 15}, {@code Failed: 2}, {@code Skipped: 1}</li>
 * </ul>
 * A terminal line wins over the block, and the last terminal line wins over earlier ones.
 * Anything else is ignored. Parsing never fails; unreadable numbers stay zero.
 */
public class TestResultParser {
    private static final Logger log = LoggerFactory.getLogger(TestResultParser.class);

    private static final Pattern TERMINAL_SUMMARY = Pattern.compile(
            "\\bTotal:\\s*(\\S+?),\\s*Passed:\\s*(\\S+?),\\s*Failed:\\s*(\\S+?),\\s*Skipped:\\s*(\\S+?)(?:\\s*-\\s*(\\S+))?\\s*$");

    private static final Pattern COMPACT_SUMMARY = Pattern.compile(
            "\\b(?:Passed|Failed)!\\s*-\\s*Failed:\\s*(\\S+?),\\s*Passed:\\s*(\\S+?),\\s*Skipped:\\s*(\\S+?),"
                    + "\\s*Total:\\s*(\\S+?),\\s*Duration:\\s*(.+?)(?:\\s+-\\s+.*)?$");

    private static final Pattern BLOCK_TOTAL = Pattern.compile("^\\s*Total tests:\\s*(\\S+)\\s*$");
    private static final Pattern BLOCK_COUNT = Pattern.compile("^\\s*(Passed|Failed|Skipped):\\s*(\\S+)\\s*$");

    private static final Pattern CLOCK_TIME = Pattern.compile("(\\d+):(\\d{2}):(\\d{2})(?:\\.(\\d+))?");
    private static final Pattern TOTAL_TIME = Pattern.compile("^\\s*Total time:\\s*([\\d.]+)\\s*Seconds", Pattern.CASE_INSENSITIVE);
    private static final Pattern SHORT_TIME_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)\\b");

    private static final Pattern FAILED_TEST = Pattern.compile(
            "^\\s*Failed\\s+([\\w.`+<>,$]+(?:\\(.*\\))?)(?:\\s+\\[[^\\]]*\\])?\\s*$");
    private static final Pattern ERROR_MESSAGE = Pattern.compile("^\\s*Error Message:\\s*(.*)$");
    private static final Pattern STACK_TRACE = Pattern.compile("^\\s*Stack Trace:\\s*(.*)$");
    private static final Pattern BLOCK_END = Pattern.compile(
            "^\\s*(?:Passed|Skipped)\\s+\\S.*$|^\\s*Standard (?:Output|Error) Messages:.*$");

    public TestExecutionSummary parseTestResults(List<String> lines) {
        TestExecutionSummary summary = new TestExecutionSummary();
        if (lines == null || lines.isEmpty()) {
            return summary;
        }

        int[] terminalCounts = null;
        Duration terminalTime = null;
        int[] blockCounts = new int[4];
        boolean blockSeen = false;
        Duration fallbackTime = null;

        for (String line : lines) {
            if (line == null) {
                continue;
            }

            Matcher terminal = TERMINAL_SUMMARY.matcher(line);
            if (terminal.find()) {
                terminalCounts = new int[]{
                        parseCount(terminal.group(1)),
                        parseCount(terminal.group(2)),
                        parseCount(terminal.group(3)),
                        parseCount(terminal.group(4))
                };
                terminalTime = terminal.group(5) != null ? parseClockTime(terminal.group(5)) : null;
                continue;
            }

            Matcher compact = COMPACT_SUMMARY.matcher(line);
            if (compact.find()) {
                terminalCounts = new int[]{
                        parseCount(compact.group(4)),
                        parseCount(compact.group(2)),
                        parseCount(compact.group(1)),
                        parseCount(compact.group(3))
                };
                terminalTime = parseShortDuration(compact.group(5));
                continue;
            }

            Matcher total = BLOCK_TOTAL.matcher(line);
            if (total.matches()) {
                blockCounts[0] = parseCount(total.group(1));
                blockSeen = true;
                continue;
            }

            Matcher count = BLOCK_COUNT.matcher(line);
            if (count.matches()) {
                int value = parseCount(count.group(2));
                switch (count.group(1)) {
                    case "Passed":
                        blockCounts[1] = value;
                        break;
                    case "Failed":
                        blockCounts[2] = value;
                        break;
                    default:
                        blockCounts[3] = value;
                        break;
                }
                blockSeen = true;
                continue;
            }

            if (line.contains("Test Run Successful") || line.contains("Test Run Failed")) {
                Duration time = parseClockTime(line);
                if (time != null) {
                    fallbackTime = time;
                }
                continue;
            }

            Matcher totalTime = TOTAL_TIME.matcher(line);
            if (totalTime.find()) {
                Duration time = parseSeconds(totalTime.group(1));
                if (time != null) {
                    fallbackTime = time;
                }
            }
        }

        int[] counts = terminalCounts != null ? terminalCounts : (blockSeen ? blockCounts : new int[4]);
        applyCounts(summary, counts);

        if (terminalTime != null) {
            summary.setExecutionTime(terminalTime);
        } else if (fallbackTime != null) {
            summary.setExecutionTime(fallbackTime);
        }

        summary.setFailures(parseFailures(lines));
        return summary;
    }

    /**
     * Collects failed tests from the runner's detailed output:
     * <pre>
     *   Failed Ns.CalculatorTests.Divide [12 ms]
     *   Error Message:
     *    Assert.Equal() Failure
     *   Stack Trace:
     *      at Ns.CalculatorTests.Divide() in CalculatorTests.cs:line 42
     * </pre>
     */
    public List<TestFailure> parseFailures(List<String> lines) {
        List<TestFailure> failures = new ArrayList<>();
        FailureBuilder current = null;
        Section section = Section.NONE;

        for (String line : lines) {
            if (line == null) {
                continue;
            }
            Matcher header = FAILED_TEST.matcher(line);
            if (header.matches()) {
                if (current != null) {
                    failures.add(current.build());
                }
                current = new FailureBuilder(header.group(1));
                section = Section.NONE;
                continue;
            }
            if (current == null) {
                continue;
            }
            if (BLOCK_END.matcher(line).matches() || TERMINAL_SUMMARY.matcher(line).find()
                    || COMPACT_SUMMARY.matcher(line).find()) {
                failures.add(current.build());
                current = null;
                section = Section.NONE;
                continue;
            }

            Matcher message = ERROR_MESSAGE.matcher(line);
            if (message.matches()) {
                section = Section.MESSAGE;
                current.appendMessage(message.group(1));
                continue;
            }
            Matcher stack = STACK_TRACE.matcher(line);
            if (stack.matches()) {
                section = Section.STACK;
                current.appendStack(stack.group(1));
                continue;
            }
            if (section == Section.MESSAGE) {
                current.appendMessage(line);
            } else if (section == Section.STACK) {
                current.appendStack(line);
            }
        }
        if (current != null) {
            failures.add(current.build());
        }
        return failures;
    }

    private void applyCounts(TestExecutionSummary summary, int[] counts) {
        int passed = counts[1];
        int failed = counts[2];
        int skipped = counts[3];
        int sum = passed + failed + skipped;
        int total = counts[0];
        if (total != sum) {
            log.debug("Reported total {} differs from passed+failed+skipped {}, using the sum", total, sum);
            total = sum;
        }
        summary.setTotalTests(total);
        summary.setPassedTests(passed);
        summary.setFailedTests(failed);
        summary.setSkippedTests(skipped);
    }

    private static int parseCount(String token) {
        if (token == null) {
            return 0;
        }
        try {
            int value = Integer.parseInt(token.trim());
            return Math.max(value, 0);
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed count '{}'", token);
            return 0;
        }
    }

    /** Parses {@code HH:MM:SS[.fraction]}; returns null when no such token is present. */
    static Duration parseClockTime(String text) {
        Matcher m = CLOCK_TIME.matcher(text);
        if (!m.find()) {
            return null;
        }
        try {
            long hours = Long.parseLong(m.group(1));
            long minutes = Long.parseLong(m.group(2));
            long seconds = Long.parseLong(m.group(3));
            long nanos = 0;
            if (m.group(4) != null) {
                String fraction = m.group(4);
                fraction = fraction.length() > 9 ? fraction.substring(0, 9) : String.format("%-9s", fraction).replace(' ', '0');
                nanos = Long.parseLong(fraction);
            }
            return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds).plusNanos(nanos);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Duration parseSeconds(String seconds) {
        try {
            return Duration.ofNanos(Math.round(Double.parseDouble(seconds) * 1_000_000_000L));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Parses durations such as {@code 5 s}, {@code 123 ms} or {@code 1 m 5 s}. */
    private static Duration parseShortDuration(String text) {
        Matcher m = SHORT_TIME_PART.matcher(text);
        Duration duration = null;
        while (m.find()) {
            double value;
            try {
                value = Double.parseDouble(m.group(1));
            } catch (NumberFormatException e) {
                continue;
            }
            long nanos;
            switch (m.group(2)) {
                case "ms":
                    nanos = Math.round(value * 1_000_000L);
                    break;
                case "s":
                    nanos = Math.round(value * 1_000_000_000L);
                    break;
                case "m":
                    nanos = Math.round(value * 60_000_000_000L);
                    break;
                default:
                    nanos = Math.round(value * 3_600_000_000_000L);
                    break;
            }
            duration = (duration == null ? Duration.ZERO : duration).plusNanos(nanos);
        }
        return duration;
    }

    private enum Section {
        NONE, MESSAGE, STACK
    }

    private static final class FailureBuilder {
        private final String qualifiedName;
        private final StringBuilder message = new StringBuilder();
        private final StringBuilder stackTrace = new StringBuilder();

        FailureBuilder(String qualifiedName) {
            this.qualifiedName = qualifiedName;
        }

        void appendMessage(String text) {
            append(message, text);
        }

        void appendStack(String text) {
            append(stackTrace, text);
        }

        private static void append(StringBuilder sb, String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return;
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(trimmed);
        }

        TestFailure build() {
            int paren = qualifiedName.indexOf('(');
            String withoutArgs = paren >= 0 ? qualifiedName.substring(0, paren) : qualifiedName;
            int dot = withoutArgs.lastIndexOf('.');
            String testClass = dot > 0 ? withoutArgs.substring(0, dot) : "";
            String testName = dot > 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
            return TestFailure.builder()
                    .testName(testName)
                    .testClass(testClass)
                    .errorMessage(message.length() > 0 ? message.toString() : null)
                    .stackTrace(stackTrace.length() > 0 ? stackTrace.toString() : null)
                    .build();
        }
    }
}
