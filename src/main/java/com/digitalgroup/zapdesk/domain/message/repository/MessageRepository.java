package com.digitalgroup.zapdesk.domain.message.repository;

import com.digitalgroup.zapdesk.domain.message.entity.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    Optional<Message> findFirstByTenantIdAndShortIdOrderByCreatedAtDesc(Long tenantId, String shortId);

    Optional<Message> findFirstByTenantIdAndExternalIdOrderByCreatedAtDesc(Long tenantId, String externalId);

    boolean existsByTenantIdAndExternalId(Long tenantId, String externalId);

    boolean existsByTenantIdAndShortId(Long tenantId, String shortId);

    /**
     * Legacy rows stored the whole serialized id without a short id; match them by substring.
     */
    @Query("""
            SELECT m FROM Message m
            WHERE m.tenantId = :tenantId
            AND m.externalId LIKE CONCAT('%', :fragment, '%')
            ORDER BY m.createdAt DESC
            """)
    List<Message> findByExternalIdContaining(@Param("tenantId") Long tenantId,
                                             @Param("fragment") String fragment,
                                             Pageable pageable);
}
