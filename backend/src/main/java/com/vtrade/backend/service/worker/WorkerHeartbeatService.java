package com.vtrade.backend.service.worker;

import com.vtrade.backend.model.WorkerHeartbeat;
import com.vtrade.backend.repository.WorkerHeartbeatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class WorkerHeartbeatService {

    private final WorkerHeartbeatRepository heartbeatRepository;

    @Transactional
    public WorkerHeartbeat beat(String workerId, int scanned, int processed, int skipped, int errors, long elapsedMs) {
        WorkerHeartbeat heartbeat = heartbeatRepository.findByWorkerId(workerId)
                .orElseGet(() -> WorkerHeartbeat.builder().workerId(workerId).build());
        heartbeat.setHost(hostName());
        heartbeat.setLastRunAt(LocalDateTime.now());
        heartbeat.setScanned(scanned);
        heartbeat.setProcessed(processed);
        heartbeat.setSkipped(skipped);
        heartbeat.setErrors(errors);
        heartbeat.setElapsedMs(elapsedMs);
        return heartbeatRepository.save(heartbeat);
    }

    public List<WorkerHeartbeat> list() {
        return heartbeatRepository.findAll();
    }

    private String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Host name unavailable for heartbeat: {}", e.getMessage());
            return "unknown";
        }
    }
}
