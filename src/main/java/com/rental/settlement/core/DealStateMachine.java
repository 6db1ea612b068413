package com.rental.settlement.core;

import com.rental.settlement.api.ResourceNotFoundException;
import com.rental.settlement.domain.ConversationParties;
import com.rental.settlement.domain.DealView;
import com.rental.settlement.domain.UserRole;
import com.rental.settlement.messaging.NotificationDispatcher;
import com.rental.settlement.persistence.service.DealLedgerService;
import com.rental.settlement.persistence.service.DealLedgerService.ConfirmationResult;
import com.rental.settlement.persistence.service.DealLedgerService.DealOpening;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Two-sided deal confirmation for a conversation. Owner and tenant confirm independently, in
 * any order; the deal completes on the second confirmation. Ledger writes commit inside
 * {@link DealLedgerService}, so notifications dispatched from here only ever describe
 * committed state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DealStateMachine {

    private final ConversationDirectory conversationDirectory;
    private final DealLedgerService dealLedger;
    private final UserDirectory userDirectory;
    private final PropertyCatalog propertyCatalog;
    private final NotificationDispatcher notificationDispatcher;

    /**
     * Owner confirms the deal of a conversation, optionally fixing the agreed rent.
     *
     * @throws ResourceNotFoundException when the conversation does not exist or is not owned by {@code ownerId}
     */
    public DealView ownerConfirm(String conversationId, String ownerId, Integer agreedRent) {
        return confirm(conversationId, ownerId, UserRole.OWNER, agreedRent);
    }

    /**
     * Tenant confirms the deal of a conversation.
     *
     * @throws ResourceNotFoundException when the conversation does not exist or {@code tenantId} is not its tenant
     */
    public DealView tenantConfirm(String conversationId, String tenantId) {
        return confirm(conversationId, tenantId, UserRole.TENANT, null);
    }

    private DealView confirm(String conversationId, String userId, UserRole party, Integer agreedRent) {
        ConversationParties parties = conversationDirectory.findConversationForParty(conversationId, userId, party)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.CONVERSATION_NOT_FOUND,
                        "Conversation not found"));

        DealOpening opening = openDeal(parties, agreedRent, userId);
        ConfirmationResult result = dealLedger.applyConfirmation(opening.getDeal().getId(), party, agreedRent);
        DealView deal = withSummaries(result.getDeal());

        if (opening.isCreated()) {
            UserRole otherParty = party == UserRole.OWNER ? UserRole.TENANT : UserRole.OWNER;
            submit(() -> notificationDispatcher.dealCreated(deal, otherParty), "DEAL_CREATED", deal.getId());
        }
        if (result.isCompletedNow()) {
            submit(() -> notificationDispatcher.dealCompleted(deal), "DEAL_COMPLETED", deal.getId());
        }
        return deal;
    }

    /**
     * Returns the deal of a conversation, creating it in PENDING_BOTH if needed. Either party
     * may call this.
     *
     * @param agreedRent rent for a new deal; the property's listed rent when null
     */
    public DealView getOrCreateDeal(String conversationId, String userId, Integer agreedRent) {
        ConversationParties parties = conversationDirectory.findConversationForParticipant(conversationId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.CONVERSATION_NOT_FOUND,
                        "Conversation not found"));
        DealOpening opening = openDeal(parties, agreedRent, userId);
        DealView deal = withSummaries(opening.getDeal());
        if (opening.isCreated()) {
            UserRole otherParty = userId.equals(parties.getOwnerId()) ? UserRole.TENANT : UserRole.OWNER;
            submit(() -> notificationDispatcher.dealCreated(deal, otherParty), "DEAL_CREATED", deal.getId());
        }
        return deal;
    }

    /** The participant's deal for a conversation, if one exists. */
    public Optional<DealView> getDealByConversation(String conversationId, String userId) {
        return dealLedger.findByConversationForParticipant(conversationId, userId).map(this::withSummaries);
    }

    /**
     * Deals of a user, newest first.
     *
     * @param role OWNER lists deals as owner; any other role lists deals as tenant
     */
    public List<DealView> getUserDeals(String userId, UserRole role) {
        return dealLedger.findUserDeals(userId, role).stream()
                .map(this::withSummaries)
                .collect(Collectors.toList());
    }

    public DealView cancelDeal(String dealId, String userId) {
        return withSummaries(dealLedger.cancel(dealId, userId));
    }

    private DealOpening openDeal(ConversationParties parties, Integer agreedRent, String userId) {
        try {
            return dealLedger.openDeal(parties, agreedRent);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent deal insert for conversationId={}, using the existing deal", parties.getConversationId());
            DealView existing = dealLedger.findByConversationForParticipant(parties.getConversationId(), userId)
                    .orElseThrow(() -> e);
            return new DealOpening(existing, false);
        }
    }

    private DealView withSummaries(DealView deal) {
        return deal.toBuilder()
                .owner(userDirectory.findUser(deal.getOwnerId()).orElse(null))
                .tenant(userDirectory.findUser(deal.getTenantId()).orElse(null))
                .property(propertyCatalog.findProperty(deal.getPropertyId()).orElse(null))
                .build();
    }

    private void submit(Runnable dispatch, String kind, String dealId) {
        try {
            dispatch.run();
        } catch (TaskRejectedException e) {
            log.warn("Notification executor saturated, {} notification dropped for dealId={}", kind, dealId);
        } catch (RuntimeException e) {
            log.error("Could not submit {} notification for dealId={}", kind, dealId, e);
        }
    }
}
