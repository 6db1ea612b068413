package com.rental.settlement.persistence.service;

import com.rental.settlement.api.ConflictException;
import com.rental.settlement.api.InvalidStateException;
import com.rental.settlement.api.ResourceNotFoundException;
import com.rental.settlement.core.PropertyCatalog;
import com.rental.settlement.core.SuccessFeeSchedule;
import com.rental.settlement.domain.ConversationParties;
import com.rental.settlement.domain.DealPaymentStatus;
import com.rental.settlement.domain.DealStatus;
import com.rental.settlement.domain.DealView;
import com.rental.settlement.domain.UserRole;
import com.rental.settlement.persistence.entity.DealEntity;
import com.rental.settlement.persistence.repository.DealRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Transactional writes and reads of deals. Confirmation and cancellation lock the deal row,
 * so the confirming flag, the derived status, the success fee and the property update commit
 * together or not at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DealLedgerService {

    private final DealRepository dealRepository;
    private final SuccessFeeSchedule feeSchedule;
    private final PropertyCatalog propertyCatalog;

    /**
     * Inserts the deal of a conversation unless one exists. Runs in its own transaction so a
     * concurrent insert losing on the unique conversation constraint surfaces as
     * {@link org.springframework.dao.DataIntegrityViolationException} without poisoning the
     * caller's work.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DealOpening openDeal(ConversationParties parties, Integer agreedRent) {
        Optional<DealEntity> existing = dealRepository.findByConversationId(parties.getConversationId());
        if (existing.isPresent()) {
            return new DealOpening(existing.get().toView(), false);
        }
        Integer rent = agreedRent != null ? agreedRent : parties.getAgreedRentDefault();
        if (rent == null || rent <= 0) {
            throw new IllegalArgumentException("agreedRent must be positive when the property has no listed rent");
        }
        DealEntity deal = DealEntity.builder()
                .conversationId(parties.getConversationId())
                .propertyId(parties.getPropertyId())
                .ownerId(parties.getOwnerId())
                .tenantId(parties.getTenantId())
                .agreedRent(rent)
                .status(DealStatus.PENDING_BOTH)
                .paymentStatus(DealPaymentStatus.UNPAID)
                .build();
        DealEntity saved = dealRepository.saveAndFlush(deal);
        log.info("Deal opened: dealId={} conversationId={} agreedRent={}", saved.getId(), saved.getConversationId(), rent);
        return new DealOpening(saved.toView(), true);
    }

    /**
     * Records one party's confirmation. Completes the deal in the same transaction when both
     * parties have confirmed: the fee is computed once, {@code completedAt} is stamped and the
     * property is marked rented. Confirming a completed deal changes nothing.
     *
     * @param party      OWNER or TENANT
     * @param agreedRent replaces the stored rent when not null and the deal is still open
     * @throws InvalidStateException when the deal was cancelled
     */
    @Transactional
    public ConfirmationResult applyConfirmation(String dealId, UserRole party, Integer agreedRent) {
        DealEntity deal = dealRepository.findByIdForUpdate(dealId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.DEAL_NOT_FOUND, "Deal not found"));

        if (deal.getCompletedAt() != null) {
            log.debug("Deal already completed, confirmation is a no-op: dealId={} party={}", dealId, party);
            return new ConfirmationResult(deal.toView(), false);
        }
        if (deal.getCancelledAt() != null) {
            throw new InvalidStateException(InvalidStateException.INVALID_DEAL_STATUS, "Deal has been cancelled");
        }

        Instant now = Instant.now();
        if (party == UserRole.OWNER) {
            deal.setOwnerConfirmed(true);
            deal.setOwnerConfirmedAt(now);
        } else if (party == UserRole.TENANT) {
            deal.setTenantConfirmed(true);
            deal.setTenantConfirmedAt(now);
        } else {
            throw new IllegalArgumentException("Only an owner or a tenant can confirm a deal");
        }
        if (agreedRent != null) {
            if (agreedRent <= 0) {
                throw new IllegalArgumentException("agreedRent must be positive");
            }
            deal.setAgreedRent(agreedRent);
        }

        boolean completedNow = false;
        if (deal.derivedStatus() == DealStatus.COMPLETED) {
            completeDeal(deal, now);
            completedNow = true;
        }
        deal.setStatus(deal.derivedStatus());
        DealEntity saved = dealRepository.save(deal);
        log.info("Deal confirmed: dealId={} party={} status={}", dealId, party, saved.getStatus());
        return new ConfirmationResult(saved.toView(), completedNow);
    }

    private void completeDeal(DealEntity deal, Instant now) {
        if (deal.getSuccessFeeAmount() == null) {
            deal.setSuccessFeeAmount(feeSchedule.feeFor(deal.getAgreedRent()));
        }
        deal.setCompletedAt(now);
        propertyCatalog.markPropertyRented(deal.getPropertyId());
        log.info("Deal completed: dealId={} agreedRent={} successFee={}",
                deal.getId(), deal.getAgreedRent(), deal.getSuccessFeeAmount());
    }

    /**
     * Cancels a deal on behalf of one of its parties. Deals not involving the caller are
     * reported as not found. Cancelling twice is acknowledged.
     *
     * @throws ConflictException when the deal is already completed
     */
    @Transactional
    public DealView cancel(String dealId, String userId) {
        DealEntity deal = dealRepository.findByIdForUpdate(dealId)
                .filter(d -> d.getOwnerId().equals(userId) || d.getTenantId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.DEAL_NOT_FOUND, "Deal not found"));

        if (deal.derivedStatus() == DealStatus.COMPLETED) {
            throw new ConflictException(ConflictException.DEAL_ALREADY_COMPLETED, "Completed deals cannot be cancelled");
        }
        if (deal.getCancelledAt() != null) {
            return deal.toView();
        }
        deal.setCancelledAt(Instant.now());
        deal.setStatus(DealStatus.CANCELLED);
        DealEntity saved = dealRepository.save(deal);
        log.info("Deal cancelled: dealId={} by userId={}", dealId, userId);
        return saved.toView();
    }

    @Transactional(readOnly = true)
    public Optional<DealView> findDeal(String dealId) {
        return dealRepository.findById(dealId).map(DealEntity::toView);
    }

    @Transactional(readOnly = true)
    public Optional<DealView> findByConversationForParticipant(String conversationId, String userId) {
        return dealRepository.findByConversationIdAndParticipant(conversationId, userId).map(DealEntity::toView);
    }

    /** Deals of a user, newest first: as owner when {@code role} is OWNER, otherwise as tenant. */
    @Transactional(readOnly = true)
    public List<DealView> findUserDeals(String userId, UserRole role) {
        List<DealEntity> deals = role == UserRole.OWNER
                ? dealRepository.findByOwnerIdOrderByCreatedAtDesc(userId)
                : dealRepository.findByTenantIdOrderByCreatedAtDesc(userId);
        return deals.stream().map(DealEntity::toView).collect(Collectors.toList());
    }

    @Value
    public static class DealOpening {
        DealView deal;
        boolean created;
    }

    @Value
    public static class ConfirmationResult {
        DealView deal;
        /** True only for the confirmation that moved the deal into COMPLETED. */
        boolean completedNow;
    }
}
