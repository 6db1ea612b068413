package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

/**
 * The two parties and the property of a conversation, as seen by the settlement core.
 */
@Value
@Builder(toBuilder = true)
public class ConversationParties {

    String conversationId;
    String propertyId;
    String ownerId;
    String tenantId;
    /** Listed rent of the property; used when a confirmation does not supply a rent. */
    Integer agreedRentDefault;

    public boolean involves(String userId) {
        return ownerId.equals(userId) || tenantId.equals(userId);
    }
}
