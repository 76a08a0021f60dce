package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

/**
 * Reason codes returned with an ignored webhook result.
 */
public final class IgnoreReason {

    public static final String GROUP_MESSAGE = "group_message";
    public static final String STATUS_BROADCAST = "status_broadcast";
    public static final String SELF_MESSAGE = "self_message";
    public static final String SELF_MESSAGE_ACK = "self_message_ack";
    public static final String SYSTEM_MESSAGE = "system_message";
    public static final String EMPTY_MESSAGE = "empty_message";
    public static final String PLACEHOLDER_CONTENT = "placeholder_content";
    public static final String DUPLICATE_MESSAGE = "duplicate_message";
    public static final String GATEWAY_NOT_FOUND = "gateway_not_found";
    public static final String UNSUPPORTED_EVENT = "unsupported_event";
    public static final String INVALID_PAYLOAD = "invalid_payload";
    public static final String INVALID_PHONE = "invalid_phone";
    public static final String UNRESOLVED_MASKED_IDENTITY = "unresolved_masked_identity";
    public static final String ACK_FOR_UNRESOLVED_LID_NO_LEAD = "ack_for_unresolved_lid_no_lead";
    public static final String ACK_FOR_UNKNOWN_LEAD = "ack_for_unknown_lead";
    public static final String UNTRACKED_RECEIPT = "untracked_receipt";
    public static final String MESSAGE_NOT_FOUND = "message_not_found";

    private IgnoreReason() {}
}
