package com.eventscheduler.eventsvc.infra.persistence;

import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.shared.exception.UserNotFoundException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsBySlug(String slug);

    /**
     * Disabled accounts are treated as missing: their outstanding JWTs grant nothing.
     */
    default User getActiveUser(UUID id) {
        return findById(id)
                .filter(User::isActive)
                .orElseThrow(UserNotFoundException::new);
    }
}
