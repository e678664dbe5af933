package com.vtrade.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "worker_heartbeats")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerHeartbeat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "worker_id", nullable = false, unique = true, length = 64)
    private String workerId;

    @Column(length = 128)
    private String host;

    @Column(name = "last_run_at", nullable = false)
    private LocalDateTime lastRunAt;

    private int scanned;
    private int processed;
    private int skipped;
    private int errors;

    @Column(name = "elapsed_ms")
    private long elapsedMs;
}
