package com.sandy.netwatch.monitor.entity;

import com.sandy.netwatch.monitor.model.AlertCategory;
import com.sandy.netwatch.monitor.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Persisted alert record: a threshold violation, an anomaly, or a monitor health/configuration problem.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_created", columnList = "createdAt"),
        @Index(name = "idx_alerts_signature", columnList = "signature")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private AlertCategory category;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Severity severity;

    /** Monitoring key, or the configuration subject for CONFIGURATION alerts. */
    @Column(length = 200)
    private String monitoredKey;

    @Column(length = 500)
    private String message;

    /** Structured details serialized as JSON. */
    @Column(length = 4000)
    private String details;

    /** When the condition was observed (sample time). */
    private LocalDateTime occurredAt;

    private LocalDateTime createdAt;

    /** For duplicate suppression: category + key + message. */
    @Column(length = 300)
    private String signature;
}
