package com.aiusage.attribution.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * Attributed spend in minor currency units (cents for USD).
 *
 * Reconciliation status is advisory: it is not part of the value comparison,
 * and a replaced amount resets it to PENDING.
 */
@Entity
@Table(name = "cost_facts",
        uniqueConstraints = @UniqueConstraint(name = "uk_cost_fact_natural_key", columnNames = {
                "fact_date", "source_id", "canonical_user_id", "platform_category", "dimension_discriminator"
        }),
        indexes = {
                @Index(name = "idx_cost_fact_partition", columnList = "fact_date, source_id"),
                @Index(name = "idx_cost_fact_user", columnList = "canonical_user_id, fact_date")
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
public class CostFact extends AttributedFact {

    @Column(nullable = false, precision = 20, scale = 6)
    private BigDecimal amountMinorUnits;

    @Column(nullable = false, length = 3)
    private String currency;

    private boolean estimated;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private ReconciliationStatus reconciliationStatus;

    public boolean sameValueAs(CostFact other) {
        return sameAttributionAs(other)
                && amountMinorUnits.compareTo(other.amountMinorUnits) == 0
                && Objects.equals(currency, other.currency)
                && estimated == other.estimated;
    }

    public void copyValueFrom(CostFact source) {
        copyAttributionFrom(source);
        amountMinorUnits = source.amountMinorUnits;
        currency = source.currency;
        estimated = source.estimated;
        reconciliationStatus = ReconciliationStatus.PENDING;
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> snapshot = super.describe();
        snapshot.put("amountMinorUnits", amountMinorUnits == null ? null : amountMinorUnits.toPlainString());
        snapshot.put("currency", currency);
        snapshot.put("estimated", estimated);
        snapshot.put("reconciliationStatus", reconciliationStatus == null ? null : reconciliationStatus.name());
        return snapshot;
    }

    @Override
    public FactType factType() {
        return FactType.COST;
    }
}
