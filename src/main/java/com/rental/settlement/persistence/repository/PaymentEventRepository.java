package com.rental.settlement.persistence.repository;

import com.rental.settlement.domain.PaymentEventName;
import com.rental.settlement.persistence.entity.PaymentEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for payment events (audit trail).
 */
@Repository
public interface PaymentEventRepository extends JpaRepository<PaymentEventEntity, String> {

    List<PaymentEventEntity> findByPaymentIdOrderByCreatedAtDesc(String paymentId);

    List<PaymentEventEntity> findByEventName(PaymentEventName eventName);

    long countByPaymentIdAndEventName(String paymentId, PaymentEventName eventName);
}
