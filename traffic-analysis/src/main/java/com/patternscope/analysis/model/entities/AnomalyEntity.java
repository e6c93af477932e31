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
@Table(name = "anomalies", schema = "public")
public class AnomalyEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "traffic_event_id", nullable = false)
    private Long trafficEventId;

    @Column(name = "anomaly_type", nullable = false, length = 32)
    private String anomalyType;

    @Column(name = "confidence_score", nullable = false)
    private Double confidenceScore;

    @Column(name = "affected_metrics", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> affectedMetrics;

    @Column(name = "description")
    private String description;

    @ColumnDefault("now()")
    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @PrePersist
    private void setDetectedAt() {
        this.detectedAt = Instant.now();
    }

}
