package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties.Policy;
import com.debtchecker.config.DebtCheckerProperties.Policy.DuplicatePolicy;
import com.debtchecker.config.DebtCheckerProperties.Policy.KnownAmountPolicy;
import com.debtchecker.model.CheckpointSnapshot;
import com.debtchecker.model.InputRow;
import com.debtchecker.model.LookupOutcome;
import com.debtchecker.model.RunPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which rows actually need a remote lookup.
 *
 * Successful outcomes from a previous checkpoint are reused, failed ones are
 * queried again. Rows that already carry an amount are skipped under
 * {@link KnownAmountPolicy#SKIP}. Repeated identifiers are queried once per row
 * unless {@link DuplicatePolicy#DEDUPLICATE} is set.
 */
@Component
@Slf4j
public class RunPlanner {

    public RunPlan plan(List<InputRow> rows, Optional<CheckpointSnapshot> checkpoint, Policy policy) {
        Map<String, LookupOutcome> seeded = new LinkedHashMap<>();
        int resumed = 0;

        if (checkpoint.isPresent()) {
            Set<String> wanted = new HashSet<>();
            rows.forEach(r -> wanted.add(r.identifier()));
            for (Map.Entry<String, LookupOutcome> e : checkpoint.get().completed().entrySet()) {
                if (e.getValue().isSuccess() && wanted.contains(e.getKey())) {
                    seeded.put(e.getKey(), e.getValue());
                    resumed++;
                }
            }
            log.info("Resuming from checkpoint {}: {} numbers already resolved",
                    checkpoint.get().runId(), resumed);
        }

        List<String> toQuery = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int skippedKnown = 0;
        int deduplicated = 0;

        for (InputRow row : rows) {
            String id = row.identifier();
            boolean firstTime = seen.add(id);

            if (policy.getDuplicates() == DuplicatePolicy.DEDUPLICATE && !firstTime) {
                deduplicated++;
                continue;
            }
            if (seeded.containsKey(id)) {
                continue;
            }
            if (policy.getKnownAmounts() == KnownAmountPolicy.SKIP && row.knownAmount() != null) {
                seeded.put(id, known(row.knownAmount()));
                skippedKnown++;
                continue;
            }
            toQuery.add(id);
        }

        log.info("Plan: {} to query, {} skipped with a known amount, {} resumed, {} duplicates dropped",
                toQuery.size(), skippedKnown, resumed, deduplicated);
        return new RunPlan(toQuery, seeded, resumed, skippedKnown, deduplicated);
    }

    private static LookupOutcome known(BigDecimal amount) {
        return amount.signum() > 0 ? LookupOutcome.found(amount, 0) : LookupOutcome.notFound(0);
    }
}
