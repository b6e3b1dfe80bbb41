package com.debtchecker.model;

import java.util.List;

/**
 * What a run hands back to the export layer.
 *
 * @param results   every outcome recorded before the run stopped
 * @param partial   true when the run was cancelled or aborted before all identifiers finished
 * @param remaining identifiers that were never resolved, in input order
 * @param progress  final completed / total counts
 */
public record RunResult(ResultSet results, boolean partial, List<String> remaining, Progress progress) {

    public RunResult {
        remaining = List.copyOf(remaining);
    }
}
