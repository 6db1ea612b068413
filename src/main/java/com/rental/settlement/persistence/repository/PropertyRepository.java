package com.rental.settlement.persistence.repository;

import com.rental.settlement.domain.PropertyStatus;
import com.rental.settlement.persistence.entity.PropertyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PropertyRepository extends JpaRepository<PropertyEntity, String> {

    @Modifying(flushAutomatically = true)
    @Query("UPDATE PropertyEntity p SET p.status = :status WHERE p.id = :id")
    int updateStatus(@Param("id") String id, @Param("status") PropertyStatus status);
}
