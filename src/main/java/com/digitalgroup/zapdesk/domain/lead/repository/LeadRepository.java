package com.digitalgroup.zapdesk.domain.lead.repository;

import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LeadRepository extends JpaRepository<Lead, Long> {

    Optional<Lead> findFirstByTenantIdAndPhone(Long tenantId, String phone);

    boolean existsByTenantIdAndPhone(Long tenantId, String phone);

    /**
     * Masked ids are stored with and without the @lid suffix depending on the gateway,
     * so match on either form.
     */
    @Query("""
            SELECT l FROM Lead l
            WHERE l.tenantId = :tenantId
            AND (l.originalLid = :lidDigits OR l.originalLid = CONCAT(:lidDigits, '@lid'))
            ORDER BY l.createdAt ASC
            LIMIT 1
            """)
    Optional<Lead> findByMaskedId(@Param("tenantId") Long tenantId, @Param("lidDigits") String lidDigits);
}
