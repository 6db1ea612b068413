package com.rental.settlement.persistence.service;

import com.rental.settlement.core.PropertyCatalog;
import com.rental.settlement.domain.PropertyStatus;
import com.rental.settlement.domain.PropertySummary;
import com.rental.settlement.persistence.repository.PropertyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaPropertyCatalog implements PropertyCatalog {

    private final PropertyRepository propertyRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PropertySummary> findProperty(String propertyId) {
        return propertyRepository.findById(propertyId)
                .map(p -> PropertySummary.builder()
                        .id(p.getId())
                        .title(p.getTitle())
                        .city(p.getCity())
                        .locality(p.getLocality())
                        .rentAmount(p.getRentAmount())
                        .build());
    }

    @Override
    @Transactional
    public void markPropertyRented(String propertyId) {
        int updated = propertyRepository.updateStatus(propertyId, PropertyStatus.RENTED);
        if (updated == 0) {
            log.warn("Property not found while marking rented: propertyId={}", propertyId);
        } else {
            log.info("Property marked rented: propertyId={}", propertyId);
        }
    }
}
