package com.digitalgroup.zapdesk.domain.conversation.repository;

import com.digitalgroup.zapdesk.domain.common.enums.ConversationStatus;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, Long> {

    // Reusable conversation for a lead (open or pending), newest first
    Optional<Conversation> findFirstByLeadIdAndStatusInOrderByCreatedAtDesc(Long leadId,
                                                                           Collection<ConversationStatus> statuses);

    default Optional<Conversation> findActiveByLead(Long leadId) {
        return findFirstByLeadIdAndStatusInOrderByCreatedAtDesc(leadId, ConversationStatus.ACTIVE);
    }

    @Query("SELECT c FROM Conversation c JOIN FETCH c.lead WHERE c.id = :id")
    Optional<Conversation> findWithLeadById(@Param("id") Long id);
}
