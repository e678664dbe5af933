package com.vtrade.backend.repository;

import com.vtrade.backend.model.WorkerHeartbeat;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface WorkerHeartbeatRepository extends JpaRepository<WorkerHeartbeat, Long> {
    Optional<WorkerHeartbeat> findByWorkerId(String workerId);
}
