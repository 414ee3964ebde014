package io.datascope.diagnostics;

import java.util.List;
import java.util.Map;

/**
 * Result of {@link StatementAnalyzer#analyze()}.
 *
 * @param targetLabel       label passed to {@code beginCapture}, or {@code null}
 * @param totalCount        number of captured statements
 * @param selectCount       number of captured SELECT statements
 * @param countsByKind      statement counts per kind; kinds never seen are absent
 * @param potentialNPlusOne whether a repeated SELECT pattern exists and the SELECT count
 *                          exceeds the analyzer's threshold
 * @param repeatedPatterns  SELECT patterns seen at least twice, mapped to the statement
 *                          indices that produced them, in order of first occurrence
 */
public record AnalysisReport(
    String targetLabel,
    int totalCount,
    int selectCount,
    Map<StatementKind, Integer> countsByKind,
    boolean potentialNPlusOne,
    Map<String, List<Integer>> repeatedPatterns
) {
}
