package com.rental.settlement.persistence.service;

import com.rental.settlement.core.ConversationDirectory;
import com.rental.settlement.domain.ConversationParties;
import com.rental.settlement.domain.UserRole;
import com.rental.settlement.persistence.entity.ConversationEntity;
import com.rental.settlement.persistence.entity.PropertyEntity;
import com.rental.settlement.persistence.repository.ConversationRepository;
import com.rental.settlement.persistence.repository.PropertyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves conversation parties from the shared conversations table.
 */
@Service
@RequiredArgsConstructor
public class JpaConversationDirectory implements ConversationDirectory {

    private final ConversationRepository conversationRepository;
    private final PropertyRepository propertyRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationParties> findConversationForParty(String conversationId, String userId, UserRole role) {
        Optional<ConversationEntity> conversation;
        switch (role) {
            case OWNER:
                conversation = conversationRepository.findByIdAndOwnerId(conversationId, userId);
                break;
            case TENANT:
                conversation = conversationRepository.findByIdAndTenantId(conversationId, userId);
                break;
            default:
                return Optional.empty();
        }
        return conversation.map(this::toParties);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationParties> findConversationForParticipant(String conversationId, String userId) {
        return conversationRepository.findByIdAndParticipant(conversationId, userId).map(this::toParties);
    }

    private ConversationParties toParties(ConversationEntity conversation) {
        Integer listedRent = propertyRepository.findById(conversation.getPropertyId())
                .map(PropertyEntity::getRentAmount)
                .orElse(null);
        return ConversationParties.builder()
                .conversationId(conversation.getId())
                .propertyId(conversation.getPropertyId())
                .ownerId(conversation.getOwnerId())
                .tenantId(conversation.getTenantId())
                .agreedRentDefault(listedRent)
                .build();
    }
}
