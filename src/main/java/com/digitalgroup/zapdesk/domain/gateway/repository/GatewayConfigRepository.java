package com.digitalgroup.zapdesk.domain.gateway.repository;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GatewayConfigRepository extends JpaRepository<GatewayConfig, Long> {

    Optional<GatewayConfig> findFirstByInstanceNameAndActiveTrue(String instanceName);

    Optional<GatewayConfig> findFirstByProviderAndInstanceNameAndActiveTrue(GatewayProvider provider, String instanceName);

    Optional<GatewayConfig> findFirstByTenantIdAndActiveTrueOrderByIdAsc(Long tenantId);
}
