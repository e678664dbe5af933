package com.vtrade.backend.repository;

import com.vtrade.backend.model.ProductType;
import com.vtrade.backend.model.RiskConfig;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RiskConfigRepository extends JpaRepository<RiskConfig, Long> {

    Optional<RiskConfig> findBySegmentAndProductType(String segment, ProductType productType);

    Optional<RiskConfig> findBySegmentAndProductTypeAndActiveTrue(String segment, ProductType productType);

    List<RiskConfig> findAllByOrderBySegmentAscProductTypeAsc();
}
