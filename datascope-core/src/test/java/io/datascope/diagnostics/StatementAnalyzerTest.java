package io.datascope.diagnostics;

import io.datascope.Mode;
import io.datascope.event.StatementEvent;
import io.datascope.event.StatementEvents;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StatementAnalyzerTest {

    private final StatementEvents events = new StatementEvents();

    private void execute(String sql, Object... params) {
        events.publish(new StatementEvent(sql, List.of(params), Mode.BLOCKING));
    }

    @Test
    void flagsOnePlusFiveRepeatedSelects() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);

        try (StatementAnalyzer.Capture ignored = analyzer.beginCapture("authors")) {
            execute("SELECT id, name FROM author");
            for (int i = 1; i <= 5; i++) {
                execute("SELECT id, title FROM book WHERE author_id = ?", i);
            }
        }

        AnalysisReport report = analyzer.analyze();
        assertEquals("authors", report.targetLabel());
        assertEquals(6, report.totalCount());
        assertEquals(6, report.selectCount());
        assertTrue(report.potentialNPlusOne());
        assertEquals(1, report.repeatedPatterns().size());
        assertEquals(List.of(1, 2, 3, 4, 5),
            report.repeatedPatterns().get("SELECT id, title FROM book WHERE author_id = ?"));
    }

    @Test
    void twoIdenticalSelectsStayBelowThreshold() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);

        analyzer.capture(null, () -> {
            execute("SELECT * FROM book WHERE id = 1");
            execute("SELECT * FROM book WHERE id = 2");
            return null;
        });

        AnalysisReport report = analyzer.analyze();
        assertEquals(1, report.repeatedPatterns().size());
        assertEquals(List.of(0, 1), report.repeatedPatterns().get("SELECT * FROM book WHERE id = ?"));
        assertFalse(report.potentialNPlusOne());
    }

    @Test
    void thresholdIsConfigurable() {
        StatementAnalyzer lenient = new StatementAnalyzer(events, 10);
        StatementAnalyzer strict = new StatementAnalyzer(new StatementEvents(), 1);
        assertEquals(10, lenient.selectThreshold());

        lenient.beginCapture();
        for (int i = 0; i < 5; i++) {
            execute("SELECT * FROM t WHERE id = " + i);
        }
        lenient.endCapture();
        assertFalse(lenient.analyze().potentialNPlusOne());

        assertThrows(IllegalArgumentException.class, () -> new StatementAnalyzer(events, -1));
        assertEquals(1, strict.selectThreshold());
    }

    @Test
    void distinctSelectsAreNotFlagged() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);

        analyzer.beginCapture();
        execute("SELECT * FROM a");
        execute("SELECT * FROM b");
        execute("SELECT * FROM c");
        execute("SELECT * FROM d");
        analyzer.endCapture();

        AnalysisReport report = analyzer.analyze();
        assertEquals(4, report.selectCount());
        assertTrue(report.repeatedPatterns().isEmpty());
        assertFalse(report.potentialNPlusOne());
    }

    @Test
    void normalizesWhitespaceAndClassifies() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);

        analyzer.beginCapture();
        execute("  select *\n\tFROM   t  ");
        execute("INSERT INTO t VALUES (?)", 1);
        execute("update t set a = 1");
        execute("DELETE FROM t");
        execute("CREATE TABLE x (id INT)");
        execute("   ");
        execute("(SELECT 1)");
        analyzer.endCapture();

        List<CapturedStatement> statements = analyzer.statements();
        assertEquals("select * FROM t", statements.get(0).text());
        assertEquals(StatementKind.SELECT, statements.get(0).kind());
        assertEquals(List.of(1), statements.get(1).parameters());
        assertEquals(StatementKind.UPDATE, statements.get(2).kind());
        assertEquals(StatementKind.UNKNOWN, statements.get(4).kind());
        assertEquals("", statements.get(5).text());
        assertEquals(StatementKind.UNKNOWN, statements.get(5).kind());
        assertEquals(StatementKind.UNKNOWN, statements.get(6).kind());

        Map<StatementKind, Integer> counts = analyzer.countsByKind();
        assertEquals(1, counts.get(StatementKind.SELECT));
        assertEquals(1, counts.get(StatementKind.INSERT));
        assertEquals(1, counts.get(StatementKind.DELETE));
        assertEquals(3, counts.get(StatementKind.UNKNOWN));
    }

    @Test
    void patternReplacesNumericLiteralsOnly() {
        assertEquals("SELECT * FROM t2 WHERE id = ? AND price > ?",
            StatementAnalyzer.pattern("SELECT * FROM t2 WHERE id = 42 AND price > 9.5"));
    }

    @Test
    void statementsOutsideWindowAreIgnored() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);
        execute("SELECT 'before'");

        analyzer.beginCapture();
        execute("SELECT 'during'");
        analyzer.endCapture();
        execute("SELECT 'after'");

        assertEquals(1, analyzer.statements().size());
        assertEquals("SELECT 'during'", analyzer.statements().get(0).text());
        assertEquals(0, events.listenerCount());
    }

    @Test
    void failureInsideCaptureStillUnregisters() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);

        IOException ex = assertThrows(IOException.class, () -> analyzer.capture("failing", () -> {
            execute("SELECT 1");
            throw new IOException("disk full");
        }));

        assertEquals("disk full", ex.getMessage());
        assertEquals(0, events.listenerCount());
        assertFalse(analyzer.isCapturing());
        assertEquals(1, analyzer.statements().size());
    }

    @Test
    void beginningNewCaptureEndsOpenOneAndResets() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);

        StatementAnalyzer.Capture first = analyzer.beginCapture("first");
        execute("SELECT 1");
        StatementAnalyzer.Capture second = analyzer.beginCapture("second");

        assertEquals(1, events.listenerCount());
        assertTrue(analyzer.statements().isEmpty());
        assertEquals("second", analyzer.targetLabel());

        first.close();
        assertTrue(analyzer.isCapturing());

        execute("SELECT 2");
        second.close();
        assertFalse(analyzer.isCapturing());
        assertEquals(1, analyzer.statements().size());
        assertEquals(0, events.listenerCount());
    }

    @Test
    void endCaptureIsIdempotent() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);
        analyzer.beginCapture();

        analyzer.endCapture();
        analyzer.endCapture();

        assertEquals(0, events.listenerCount());
    }

    @Test
    void concurrentStatementsGetUniqueOrderedIndices() throws Exception {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try (StatementAnalyzer.Capture ignored = analyzer.beginCapture()) {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        execute("SELECT * FROM t WHERE id = ?", i);
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        List<CapturedStatement> statements = analyzer.statements();
        assertEquals(threads * perThread, statements.size());
        Set<Integer> indices = new HashSet<>();
        for (int i = 0; i < statements.size(); i++) {
            assertEquals(i, statements.get(i).index());
            indices.add(statements.get(i).index());
        }
        assertEquals(threads * perThread, indices.size());
    }

    @Test
    void reportListsPatternsAndVerboseStatements() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);
        String longTail = "x".repeat(250);

        analyzer.beginCapture("orders");
        execute("SELECT * FROM orders");
        for (int i = 0; i < 3; i++) {
            execute("SELECT * FROM line WHERE order_id = " + i + " AND note <> '" + longTail + "'");
        }
        analyzer.endCapture();

        String summary = analyzer.report(false);
        assertTrue(summary.contains("Target: orders"));
        assertTrue(summary.contains("Total statements: 4"));
        assertTrue(summary.contains("SELECT: 4"));
        assertTrue(summary.contains("Potential N+1 detected"));
        assertTrue(summary.contains("repeated 3x"));
        assertFalse(summary.contains("1. [SELECT]"));
        assertFalse(summary.contains("x".repeat(101)));

        String verbose = analyzer.report(true);
        assertTrue(verbose.contains("1. [SELECT] SELECT * FROM orders"));
        assertTrue(verbose.contains("4. [SELECT]"));
        assertFalse(verbose.contains("x".repeat(201)));
    }

    @Test
    void reportWithoutProblem() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);
        analyzer.beginCapture();
        execute("SELECT 1");
        analyzer.endCapture();

        String report = analyzer.report(false);
        assertTrue(report.contains("No N+1 pattern detected"));
        assertFalse(report.contains("Target:"));
    }

    @Test
    void lateDeliveryFromPreviousWindowIsNotRecorded() {
        StatementAnalyzer analyzer = new StatementAnalyzer(events);
        // registered ahead of the analyzer, so it restarts the window mid-delivery
        events.register(event -> {
            if (event.sql().contains("old")) {
                analyzer.endCapture();
                analyzer.beginCapture("new");
            }
        });
        analyzer.beginCapture("old");

        execute("SELECT old FROM t");

        assertTrue(analyzer.isCapturing());
        assertEquals("new", analyzer.targetLabel());
        assertTrue(analyzer.statements().isEmpty());

        execute("SELECT fresh FROM t");
        assertEquals(1, analyzer.statements().size());
        assertEquals("SELECT fresh FROM t", analyzer.statements().get(0).text());
    }
}
