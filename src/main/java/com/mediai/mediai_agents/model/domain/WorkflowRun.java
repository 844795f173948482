package com.mediai.mediai_agents.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "workflow_runs")
@Data
public class WorkflowRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow", nullable = false)
    private String workflow; // workflow, data_pipeline, ingest_sample_data

    @Enumerated(EnumType.STRING)
    private RunStatus status = RunStatus.RUNNING;

    @Column(name = "triggered_by")
    private String triggeredBy; // API, CLI

    // Report map written when the run ends; holds {"error": ...} when the run threw
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "report_snapshot")
    private Map<String, Object> reportSnapshot;

    @Column(name = "started_at")
    private Instant startedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;
}
