package io.datascope.diagnostics;

import io.datascope.engine.EngineHandle;
import io.datascope.event.StatementEvent;
import io.datascope.event.StatementEvents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Records the statements an engine executes during a capture window and looks for the
 * N+1 query pattern: one query followed by many structurally identical SELECTs.
 *
 * <pre>{@code
 * StatementAnalyzer analyzer = new StatementAnalyzer(scopes.engine());
 * try (StatementAnalyzer.Capture capture = analyzer.beginCapture("orders")) {
 *     loadOrdersWithLines();
 * }
 * if (analyzer.analyze().potentialNPlusOne()) {
 *     analyzer.logReport(Level.WARNING, true);
 * }
 * }</pre>
 *
 * <p>A SELECT's pattern is its normalized text with numeric literals replaced by {@code ?}.
 * A pattern seen at least twice is repeated. The N+1 flag is raised when a repeated pattern
 * exists and the SELECT count is above the threshold ({@value #DEFAULT_SELECT_THRESHOLD}
 * unless configured).
 *
 * <p>Capture windows do not nest. Beginning a capture while one is open ends the open one
 * and starts over with an empty buffer; use separate analyzers for isolated windows.
 * Statements published concurrently by several sessions are all recorded, each with a
 * distinct index.
 */
public final class StatementAnalyzer {
    private static final Logger logger = Logger.getLogger(StatementAnalyzer.class.getName());

    public static final int DEFAULT_SELECT_THRESHOLD = 2;

    static final int PATTERN_DISPLAY_LIMIT = 100;
    static final int STATEMENT_DISPLAY_LIMIT = 200;
    static final int MAX_PATTERNS_SHOWN = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");
    private static final String RULE = "=".repeat(70);

    private final StatementEvents events;
    private final int selectThreshold;
    private final Object lock = new Object();

    private final List<CapturedStatement> buffer = new ArrayList<>();
    private StatementEvents.Registration registration;
    private Capture current;
    private String targetLabel;

    public StatementAnalyzer(EngineHandle engine) {
        this(Objects.requireNonNull(engine, "engine").statementEvents(), engine.nPlusOneSelectThreshold());
    }

    public StatementAnalyzer(EngineHandle engine, int selectThreshold) {
        this(Objects.requireNonNull(engine, "engine").statementEvents(), selectThreshold);
    }

    public StatementAnalyzer(StatementEvents events) {
        this(events, DEFAULT_SELECT_THRESHOLD);
    }

    public StatementAnalyzer(StatementEvents events, int selectThreshold) {
        this.events = Objects.requireNonNull(events, "events");
        if (selectThreshold < 0) {
            throw new IllegalArgumentException("selectThreshold must be >= 0");
        }
        this.selectThreshold = selectThreshold;
    }

    public int selectThreshold() {
        return selectThreshold;
    }

    public Capture beginCapture() {
        return beginCapture(null);
    }

    /**
     * Clears the buffer and starts recording. An open capture is ended first.
     *
     * @param targetLabel free-form label shown in the report, may be {@code null}
     * @return handle whose {@code close()} ends this capture
     */
    public Capture beginCapture(String targetLabel) {
        synchronized (lock) {
            if (registration != null) {
                logger.fine("Capture already open; ending it before starting a new one");
                releaseLocked();
            }
            buffer.clear();
            this.targetLabel = targetLabel;
            Capture capture = new Capture();
            current = capture;
            registration = events.register(event -> record(capture, event));
            return capture;
        }
    }

    /**
     * Runs {@code body} inside a capture window that is ended on every exit path.
     */
    public <T, X extends Exception> T capture(String targetLabel, CaptureBody<T, X> body) throws X {
        Objects.requireNonNull(body, "body");
        try (Capture ignored = beginCapture(targetLabel)) {
            return body.run();
        }
    }

    /**
     * Stops recording; the buffer keeps what was captured. Idempotent.
     */
    public void endCapture() {
        synchronized (lock) {
            releaseLocked();
        }
    }

    public boolean isCapturing() {
        synchronized (lock) {
            return registration != null;
        }
    }

    /**
     * Snapshot of the statements captured so far, in execution order.
     */
    public List<CapturedStatement> statements() {
        synchronized (lock) {
            return List.copyOf(buffer);
        }
    }

    public Map<StatementKind, Integer> countsByKind() {
        synchronized (lock) {
            return countKinds(buffer);
        }
    }

    public String targetLabel() {
        synchronized (lock) {
            return targetLabel;
        }
    }

    public AnalysisReport analyze() {
        List<CapturedStatement> snapshot;
        String label;
        synchronized (lock) {
            snapshot = List.copyOf(buffer);
            label = targetLabel;
        }
        Map<StatementKind, Integer> counts = countKinds(snapshot);
        int selects = counts.getOrDefault(StatementKind.SELECT, 0);

        Map<String, List<Integer>> byPattern = new LinkedHashMap<>();
        for (CapturedStatement statement : snapshot) {
            if (statement.kind() == StatementKind.SELECT) {
                byPattern.computeIfAbsent(pattern(statement.text()), k -> new ArrayList<>())
                    .add(statement.index());
            }
        }
        Map<String, List<Integer>> repeated = new LinkedHashMap<>();
        byPattern.forEach((pattern, indices) -> {
            if (indices.size() >= 2) {
                repeated.put(pattern, List.copyOf(indices));
            }
        });

        boolean flagged = !repeated.isEmpty() && selects > selectThreshold;
        return new AnalysisReport(label, snapshot.size(), selects, counts, flagged,
            Collections.unmodifiableMap(repeated));
    }

    /**
     * Renders the analysis as text. In verbose mode every captured statement is listed.
     */
    public String report(boolean verbose) {
        AnalysisReport analysis = analyze();
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n');
        out.append("Statement Analysis Report").append('\n');
        out.append(RULE).append('\n');
        if (analysis.targetLabel() != null) {
            out.append("Target: ").append(analysis.targetLabel()).append('\n');
        }
        out.append("Total statements: ").append(analysis.totalCount()).append('\n');
        out.append("By kind:").append('\n');
        analysis.countsByKind().forEach((kind, count) ->
            out.append("  ").append(kind).append(": ").append(count).append('\n'));

        if (analysis.potentialNPlusOne()) {
            out.append("Potential N+1 detected: ")
                .append(analysis.repeatedPatterns().size()).append(" repeated pattern(s)").append('\n');
            analysis.repeatedPatterns().entrySet().stream()
                .limit(MAX_PATTERNS_SHOWN)
                .forEach(entry -> out.append("  repeated ").append(entry.getValue().size()).append("x: ")
                    .append(truncate(entry.getKey(), PATTERN_DISPLAY_LIMIT)).append('\n'));
        } else {
            out.append("No N+1 pattern detected").append('\n');
        }

        if (verbose) {
            List<CapturedStatement> captured = statements();
            if (!captured.isEmpty()) {
                out.append("-".repeat(70)).append('\n');
                for (CapturedStatement statement : captured) {
                    out.append(statement.index() + 1).append(". [").append(statement.kind()).append("] ")
                        .append(truncate(statement.text(), STATEMENT_DISPLAY_LIMIT)).append('\n');
                }
            }
        }
        out.append(RULE).append('\n');
        return out.toString();
    }

    /**
     * Writes {@link #report(boolean)} to this class's logger at the given level.
     */
    public void logReport(Level level, boolean verbose) {
        if (logger.isLoggable(level)) {
            logger.log(level, report(verbose));
        }
    }

    static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        return WHITESPACE.matcher(sql.trim()).replaceAll(" ");
    }

    static String pattern(String normalizedSql) {
        return NUMERIC_LITERAL.matcher(normalizedSql).replaceAll("?");
    }

    private void record(Capture capture, StatementEvent event) {
        String text = normalize(event.sql());
        StatementKind kind = StatementKind.infer(text);
        synchronized (lock) {
            // a publish that started under an earlier window may still be delivering
            if (current != capture) {
                return;
            }
            buffer.add(new CapturedStatement(buffer.size(), text, kind, event.parameters()));
        }
    }

    private void releaseLocked() {
        if (registration != null) {
            registration.close();
            registration = null;
        }
        current = null;
    }

    private static Map<StatementKind, Integer> countKinds(List<CapturedStatement> statements) {
        Map<StatementKind, Integer> counts = new EnumMap<>(StatementKind.class);
        for (CapturedStatement statement : statements) {
            counts.merge(statement.kind(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    private static String truncate(String text, int limit) {
        return text.length() > limit ? text.substring(0, limit) + "..." : text;
    }

    /**
     * An open capture window. Closing it ends the capture if it is still the current one.
     */
    public final class Capture implements AutoCloseable {

        private Capture() {
        }

        public StatementAnalyzer analyzer() {
            return StatementAnalyzer.this;
        }

        @Override
        public void close() {
            synchronized (lock) {
                if (current == this) {
                    releaseLocked();
                }
            }
        }
    }
}
