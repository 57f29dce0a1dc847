package com.eventscheduler.eventsvc.infra.persistence;

import com.eventscheduler.eventsvc.domain.model.TokenPurpose;
import com.eventscheduler.eventsvc.domain.model.VerificationToken;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationTokenRepository extends JpaRepository<VerificationToken, UUID> {

    @Query("SELECT t FROM VerificationToken t JOIN FETCH t.user WHERE t.tokenHash = :hash AND t.purpose = :purpose")
    Optional<VerificationToken> findByHashAndPurpose(@Param("hash") String hash,
                                                     @Param("purpose") TokenPurpose purpose);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM VerificationToken t WHERE t.tokenHash = :hash AND t.purpose = :purpose")
    Optional<VerificationToken> findByHashAndPurposeForUpdate(@Param("hash") String hash,
                                                              @Param("purpose") TokenPurpose purpose);

    @Modifying
    @Query("UPDATE VerificationToken t SET t.consumedAt = :now " +
            "WHERE t.user.id = :userId AND t.purpose = :purpose AND t.consumedAt IS NULL")
    int consumeOutstanding(@Param("userId") UUID userId,
                           @Param("purpose") TokenPurpose purpose,
                           @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM VerificationToken t WHERE t.expiresAt < :cutoff OR t.consumedAt < :cutoff")
    int deleteSettledBefore(@Param("cutoff") Instant cutoff);

    long countByUserIdAndPurposeAndConsumedAtIsNull(UUID userId, TokenPurpose purpose);
}
