package com.rental.settlement.persistence.service;

import com.rental.settlement.core.UserDirectory;
import com.rental.settlement.domain.PartySummary;
import com.rental.settlement.persistence.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PartySummary> findUser(String userId) {
        return userRepository.findById(userId)
                .map(u -> PartySummary.builder()
                        .id(u.getId())
                        .firstName(u.getFirstName())
                        .lastName(u.getLastName())
                        .email(u.getEmail())
                        .build());
    }
}
