package com.patternscope.analysis.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "trend_suggestions", schema = "public")
public class TrendSuggestionEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "time_period_start")
    private Instant timePeriodStart;

    @Column(name = "time_period_end")
    private Instant timePeriodEnd;

    @Column(name = "suggestion_type", nullable = false, length = 32)
    private String suggestionType;

    @Column(name = "confidence_level", nullable = false)
    private Double confidenceLevel;

    @Column(name = "description", nullable = false)
    private String description;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "related_anomalies")
    private List<Long> relatedAnomalies;

    @Column(name = "action_taken")
    private String actionTaken;

    @PrePersist
    private void setCreatedAt() {
        this.createdAt = Instant.now();
    }

}
