package com.rental.settlement.core;

import com.rental.settlement.domain.PartySummary;

import java.util.Optional;

public interface UserDirectory {

    Optional<PartySummary> findUser(String userId);
}
