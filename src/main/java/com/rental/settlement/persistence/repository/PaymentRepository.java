package com.rental.settlement.persistence.repository;

import com.rental.settlement.domain.PaymentMethod;
import com.rental.settlement.domain.PaymentStatus;
import com.rental.settlement.persistence.entity.PaymentEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Repository for payments. Every status change is a conditional bulk update carrying the
 * expected prior status, so concurrent writers (client verification racing a webhook)
 * produce exactly one winner. Callers read the returned row count.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    Optional<PaymentEntity> findByDealId(String dealId);

    Optional<PaymentEntity> findByExternalOrderId(String externalOrderId);

    Optional<PaymentEntity> findByExternalPaymentId(String externalPaymentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.dealId = :dealId")
    Optional<PaymentEntity> findByDealIdForUpdate(@Param("dealId") String dealId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") String id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.status = :completed, p.externalPaymentId = :externalPaymentId, "
            + "p.externalSignature = COALESCE(:signature, p.externalSignature), "
            + "p.method = COALESCE(:method, p.method), p.completedAt = :now, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.status IN :expected")
    int markCompleted(@Param("id") String id,
                      @Param("externalPaymentId") String externalPaymentId,
                      @Param("signature") String signature,
                      @Param("method") PaymentMethod method,
                      @Param("now") Instant now,
                      @Param("completed") PaymentStatus completed,
                      @Param("expected") Collection<PaymentStatus> expected);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.status = :failed, p.failedAt = :now, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.status IN :expected")
    int markFailed(@Param("id") String id,
                   @Param("now") Instant now,
                   @Param("failed") PaymentStatus failed,
                   @Param("expected") Collection<PaymentStatus> expected);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.status = :refunded, p.refundedAt = :now, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.status = :completed")
    int markRefunded(@Param("id") String id,
                     @Param("now") Instant now,
                     @Param("refunded") PaymentStatus refunded,
                     @Param("completed") PaymentStatus completed);

    /** Claims the single refund slot of a completed payment. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.refundInitiatedAt = :now, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.status = :completed AND p.refundInitiatedAt IS NULL")
    int claimRefund(@Param("id") String id,
                    @Param("now") Instant now,
                    @Param("completed") PaymentStatus completed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.refundInitiatedAt = NULL, p.updatedAt = :now "
            + "WHERE p.id = :id AND p.externalRefundId IS NULL")
    int releaseRefundClaim(@Param("id") String id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentEntity p SET p.externalRefundId = :refundId, p.updatedAt = :now WHERE p.id = :id")
    int recordRefundId(@Param("id") String id, @Param("refundId") String refundId, @Param("now") Instant now);
}
