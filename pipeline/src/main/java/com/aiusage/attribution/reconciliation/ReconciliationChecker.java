package com.aiusage.attribution.reconciliation;

import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares aggregated cost facts with an invoice total.
 *
 * THRESHOLDS:
 * - MATCHED when the variance is within the tolerance (default 5%) of the invoice
 * - VARIANCE_FLAGGED otherwise
 * The tolerance is compared against the exact variance; the reported percentage is
 * rounded to two decimals for display only.
 * A zero invoice matches only a zero aggregate; any other aggregate is a 100% variance.
 * Facts in a different currency than the invoice are left out and noted.
 */
@Component
public class ReconciliationChecker {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal tolerancePercent;

    public ReconciliationChecker(@Value("${attribution.reconciliation.tolerance-percent:5.0}") BigDecimal tolerancePercent) {
        this.tolerancePercent = tolerancePercent;
    }

    public ReconciliationReport reconcile(ReconciliationPeriod period, List<CostFact> aggregatedFacts,
                                          GroundTruthTotal groundTruth) {
        List<String> notes = new ArrayList<>();
        Map<String, BigDecimal> bySource = new TreeMap<>();
        BigDecimal aggregated = BigDecimal.ZERO;
        int counted = 0;
        int otherCurrency = 0;

        for (CostFact fact : aggregatedFacts) {
            if (!groundTruth.currency().equalsIgnoreCase(fact.getCurrency())) {
                otherCurrency++;
                continue;
            }
            aggregated = aggregated.add(fact.getAmountMinorUnits());
            bySource.merge(fact.getSourceId(), fact.getAmountMinorUnits(), BigDecimal::add);
            counted++;
        }
        if (otherCurrency > 0) {
            notes.add(otherCurrency + " cost fact(s) in a currency other than " + groundTruth.currency() + " excluded");
        }

        BigDecimal truth = groundTruth.amountMinorUnits();
        BigDecimal net = aggregated.subtract(truth);
        BigDecimal absolute = net.abs();
        BigDecimal percent = variancePercent(aggregated, truth, absolute);
        ReconciliationStatus status = withinTolerance(aggregated, truth, absolute)
                ? ReconciliationStatus.MATCHED
                : ReconciliationStatus.VARIANCE_FLAGGED;
        boolean missingData = aggregated.signum() == 0 && truth.signum() > 0;
        if (missingData) {
            notes.add("no cost facts aggregated for a non-zero invoice");
        }

        return new ReconciliationReport(
                groundTruth.reference(),
                period,
                groundTruth.currency(),
                aggregated,
                truth,
                net,
                absolute,
                percent,
                status,
                missingData,
                bySource,
                counted,
                notes);
    }

    private boolean withinTolerance(BigDecimal aggregated, BigDecimal truth, BigDecimal absolute) {
        if (truth.signum() == 0) {
            return aggregated.signum() == 0;
        }
        return absolute.multiply(HUNDRED).compareTo(tolerancePercent.multiply(truth.abs())) <= 0;
    }

    private static BigDecimal variancePercent(BigDecimal aggregated, BigDecimal truth, BigDecimal absolute) {
        if (truth.signum() == 0) {
            return aggregated.signum() == 0
                    ? BigDecimal.ZERO.setScale(2)
                    : HUNDRED.setScale(2);
        }
        return absolute.multiply(HUNDRED).divide(truth.abs(), 2, RoundingMode.HALF_UP);
    }
}
