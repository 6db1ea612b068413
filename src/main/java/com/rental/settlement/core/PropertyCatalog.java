package com.rental.settlement.core;

import com.rental.settlement.domain.PropertySummary;

import java.util.Optional;

/**
 * Property catalog as needed by deal completion: summaries for views and notifications, and
 * the single status change a completed deal causes.
 */
public interface PropertyCatalog {

    Optional<PropertySummary> findProperty(String propertyId);

    /** Joins the caller's transaction when one is active. */
    void markPropertyRented(String propertyId);
}
