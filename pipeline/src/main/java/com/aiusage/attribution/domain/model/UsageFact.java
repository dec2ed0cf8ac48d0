package com.aiusage.attribution.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Attributed usage for one user, day, source, platform and dimension combination.
 */
@Entity
@Table(name = "usage_facts",
        uniqueConstraints = @UniqueConstraint(name = "uk_usage_fact_natural_key", columnNames = {
                "fact_date", "source_id", "canonical_user_id", "platform_category", "dimension_discriminator"
        }),
        indexes = {
                @Index(name = "idx_usage_fact_partition", columnList = "fact_date, source_id"),
                @Index(name = "idx_usage_fact_user", columnList = "canonical_user_id, fact_date")
        })
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
public class UsageFact extends AttributedFact {

    @Convert(converter = MetricMapConverter.class)
    @Column(nullable = false, length = 4000)
    private Map<String, BigDecimal> metrics;

    public boolean sameValueAs(UsageFact other) {
        return sameAttributionAs(other) && Metrics.sameValues(metrics, other.metrics);
    }

    public void copyValueFrom(UsageFact source) {
        copyAttributionFrom(source);
        metrics = new TreeMap<>(source.metrics);
    }

    @Override
    public Map<String, Object> describe() {
        Map<String, Object> snapshot = super.describe();
        snapshot.put("metrics", new TreeMap<>(metrics));
        return snapshot;
    }

    @Override
    public FactType factType() {
        return FactType.USAGE;
    }
}
