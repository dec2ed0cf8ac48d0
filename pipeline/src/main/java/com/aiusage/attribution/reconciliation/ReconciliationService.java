package com.aiusage.attribution.reconciliation;

import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.facts.FactMerger;
import com.aiusage.attribution.facts.FactStore;
import com.aiusage.attribution.pipeline.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles stored cost facts against every invoice overlapping a window
 * and marks the compared facts with the outcome.
 *
 * Runs after merging and only annotates. A failing invoice is logged and skipped;
 * only a run-fatal storage failure propagates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final FactStore factStore;
    private final GroundTruthProvider groundTruthProvider;
    private final ReconciliationChecker checker;
    private final FactMerger factMerger;

    public List<ReconciliationReport> reconcile(ReconciliationPeriod window) {
        List<GroundTruthTotal> totals = groundTruthProvider.totalsFor(window);
        log.info("Reconciling {} invoice(s) overlapping {}", totals.size(), window);

        List<ReconciliationReport> reports = new ArrayList<>();
        for (GroundTruthTotal total : totals) {
            try {
                List<CostFact> facts = factStore.findCostFactsInPeriod(total.period().start(), total.period().end())
                        .stream()
                        .filter(total::covers)
                        .toList();
                ReconciliationReport report = checker.reconcile(total.period(), facts, total);
                List<CostFact> compared = facts.stream()
                        .filter(fact -> total.currency().equalsIgnoreCase(fact.getCurrency()))
                        .toList();
                factMerger.annotateReconciliation(compared, report.status());

                if (report.isFlagged()) {
                    log.warn("Invoice {} ({}) variance {}%: aggregated {} vs invoiced {}",
                            total.reference(), total.period(), report.variancePercent(),
                            report.aggregatedMinorUnits(), report.groundTruthMinorUnits());
                } else {
                    log.info("Invoice {} ({}) matched within {}%", total.reference(), total.period(), report.variancePercent());
                }
                reports.add(report);
            } catch (PipelineException e) {
                if (e.isRunFatal()) {
                    throw e;
                }
                log.error("Failed to reconcile invoice {}: {}", total.reference(), e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("Failed to reconcile invoice {}: {}", total.reference(), e.getMessage(), e);
            }
        }
        return reports;
    }
}
