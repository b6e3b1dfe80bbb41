package com.debtchecker.model;

import java.util.List;
import java.util.Map;

/**
 * What a run actually has to do after policies and resume are applied.
 *
 * @param toQuery        identifiers to look up, in input order
 * @param seeded         outcomes known up front (checkpoint or input file), never queried
 * @param resumed        how many seeded outcomes came from a checkpoint
 * @param skippedKnown   how many rows were skipped because they already had an amount
 * @param deduplicated   how many duplicate rows were dropped
 */
public record RunPlan(
        List<String> toQuery,
        Map<String, LookupOutcome> seeded,
        int resumed,
        int skippedKnown,
        int deduplicated
) {
}
