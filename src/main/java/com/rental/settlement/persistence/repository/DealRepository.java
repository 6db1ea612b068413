package com.rental.settlement.persistence.repository;

import com.rental.settlement.domain.DealPaymentStatus;
import com.rental.settlement.persistence.entity.DealEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for deals.
 */
@Repository
public interface DealRepository extends JpaRepository<DealEntity, String> {

    Optional<DealEntity> findByConversationId(String conversationId);

    /** Row lock held until the surrounding transaction ends; serializes confirmations and cancels. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DealEntity d WHERE d.id = :id")
    Optional<DealEntity> findByIdForUpdate(@Param("id") String id);

    List<DealEntity> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<DealEntity> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    @Query("SELECT d FROM DealEntity d WHERE d.conversationId = :conversationId "
            + "AND (d.ownerId = :userId OR d.tenantId = :userId)")
    Optional<DealEntity> findByConversationIdAndParticipant(@Param("conversationId") String conversationId,
                                                           @Param("userId") String userId);

    /**
     * Marks the deal paid. Conditional on the current payment status so that only the first
     * captured payment writes the reference.
     *
     * @return number of rows updated (0 when already paid)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DealEntity d SET d.paymentStatus = :paid, d.paymentId = :paymentId, d.updatedAt = :now "
            + "WHERE d.id = :dealId AND d.paymentStatus = :unpaid")
    int markPaidIfUnpaid(@Param("dealId") String dealId,
                         @Param("paymentId") String paymentId,
                         @Param("now") Instant now,
                         @Param("paid") DealPaymentStatus paid,
                         @Param("unpaid") DealPaymentStatus unpaid);
}
