package com.digitalgroup.zapdesk.domain.lead.service;

import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts new leads in their own transaction, so a unique (tenant, phone) violation
 * raised by a concurrent insert leaves the caller's transaction usable.
 */
@Component
@RequiredArgsConstructor
public class LeadWriter {

    private final LeadRepository leadRepository;

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when another lead already owns the phone
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Lead insert(Lead lead) {
        return leadRepository.saveAndFlush(lead);
    }
}
