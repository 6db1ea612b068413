package com.rental.settlement.persistence.repository;

import com.rental.settlement.persistence.entity.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findByIdAndOwnerId(String id, String ownerId);

    Optional<ConversationEntity> findByIdAndTenantId(String id, String tenantId);

    @Query("SELECT c FROM ConversationEntity c WHERE c.id = :id AND (c.ownerId = :userId OR c.tenantId = :userId)")
    Optional<ConversationEntity> findByIdAndParticipant(@Param("id") String id, @Param("userId") String userId);
}
