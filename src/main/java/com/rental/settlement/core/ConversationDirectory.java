package com.rental.settlement.core;

import com.rental.settlement.domain.ConversationParties;
import com.rental.settlement.domain.UserRole;

import java.util.Optional;

/**
 * Lookup of conversations owned by the messaging service.
 */
public interface ConversationDirectory {

    /**
     * Finds the conversation only if {@code userId} takes part in it with the given role.
     *
     * @param role OWNER or TENANT
     */
    Optional<ConversationParties> findConversationForParty(String conversationId, String userId, UserRole role);

    /** Finds the conversation if {@code userId} is either of its parties. */
    Optional<ConversationParties> findConversationForParticipant(String conversationId, String userId);
}
