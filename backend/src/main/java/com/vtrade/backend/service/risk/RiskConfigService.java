package com.vtrade.backend.service.risk;

import com.vtrade.backend.dto.RiskConfigRequest;
import com.vtrade.backend.exception.NotFoundException;
import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.RiskConfig;
import com.vtrade.backend.repository.RiskConfigRepository;
import com.vtrade.backend.service.AuditEventService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class RiskConfigService {

    private final RiskConfigRepository riskConfigRepository;
    private final AuditEventService auditEventService;

    public Optional<RiskConfig> findActive(String segment, ProductType productType) {
        return riskConfigRepository.findBySegmentAndProductTypeAndActiveTrue(MarginCalculator.normalize(segment), productType);
    }

    public List<RiskConfig> list() {
        return riskConfigRepository.findAllByOrderBySegmentAscProductTypeAsc();
    }

    @Transactional
    public RiskConfig upsert(Long adminUserId, RiskConfigRequest request) {
        String segment = MarginCalculator.normalize(request.getSegment());
        RiskConfig config = riskConfigRepository.findBySegmentAndProductType(segment, request.getProductType())
                .orElseGet(() -> RiskConfig.builder()
                        .segment(segment)
                        .productType(request.getProductType())
                        .build());
        config.setLeverage(request.getLeverage());
        config.setBrokerageFlat(request.getBrokerageFlat());
        config.setBrokerageRate(request.getBrokerageRate());
        config.setBrokerageCap(request.getBrokerageCap());
        config.setActive(request.getActive() == null || request.getActive());
        RiskConfig saved = riskConfigRepository.save(config);
        log.info("Risk config saved segment={} productType={} leverage={} active={}",
                segment, request.getProductType(), request.getLeverage(), saved.isActive());
        auditEventService.recordEvent(adminUserId, "risk_config", "UPSERT", "risk_config", saved.getId(),
                "Risk config saved for " + segment + "/" + request.getProductType(),
                Map.of("leverage", request.getLeverage().toPlainString(), "active", saved.isActive()));
        return saved;
    }

    @Transactional
    public RiskConfig deactivate(Long adminUserId, Long id) {
        RiskConfig config = riskConfigRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Risk config not found"));
        config.setActive(false);
        RiskConfig saved = riskConfigRepository.save(config);
        log.info("Risk config deactivated id={} segment={} productType={}", id, config.getSegment(), config.getProductType());
        auditEventService.recordEvent(adminUserId, "risk_config", "DEACTIVATE", "risk_config", id,
                "Risk config deactivated", null);
        return saved;
    }
}
