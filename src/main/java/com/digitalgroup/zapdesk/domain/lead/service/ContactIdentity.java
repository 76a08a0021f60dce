package com.digitalgroup.zapdesk.domain.lead.service;

import com.digitalgroup.zapdesk.util.ChatIdUtils;
import com.digitalgroup.zapdesk.util.NormalizedPhone;

/**
 * What an event tells us about who the contact is. At least one side is known.
 */
public record ContactIdentity(NormalizedPhone phone, String maskedId) {

    public ContactIdentity {
        if (phone == null && (maskedId == null || maskedId.isBlank())) {
            throw new IllegalArgumentException("A contact needs a phone or a masked id");
        }
    }

    public static ContactIdentity ofPhone(NormalizedPhone phone) {
        return new ContactIdentity(phone, null);
    }

    public static ContactIdentity of(NormalizedPhone phone, String maskedId) {
        return new ContactIdentity(phone, maskedId);
    }

    public boolean hasPhone() {
        return phone != null;
    }

    public boolean hasMaskedId() {
        return maskedId != null && !maskedId.isBlank();
    }

    /**
     * Masked id in its stored form, {@code <digits>@lid}.
     */
    public String storedMaskedId() {
        return hasMaskedId() ? ChatIdUtils.maskedDigits(maskedId) + ChatIdUtils.MASKED_SUFFIX : null;
    }
}
