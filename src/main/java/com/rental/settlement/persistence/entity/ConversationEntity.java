package com.rental.settlement.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Conversation between an owner and a tenant about one property. Written by the messaging
 * service; read here to resolve deal parties.
 */
@Entity
@Table(name = "conversations", indexes = {
        @Index(name = "idx_conversation_owner_id", columnList = "owner_id"),
        @Index(name = "idx_conversation_tenant_id", columnList = "tenant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "property_id", nullable = false)
    private String propertyId;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "created_at")
    private Instant createdAt;
}
