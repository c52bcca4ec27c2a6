package org.propertyplus.repo;

import jakarta.persistence.LockModeType;
import org.propertyplus.model.VerificationSessionEntity;
import org.propertyplus.verification.VerificationPurpose;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface VerificationSessionRepository extends JpaRepository<VerificationSessionEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from VerificationSessionEntity s where s.subject = :subject and s.purpose = :purpose")
    Optional<VerificationSessionEntity> findForUpdate(@Param("subject") String subject,
                                                      @Param("purpose") VerificationPurpose purpose);

    @Modifying
    @Query("delete from VerificationSessionEntity s where s.subject = :subject and s.purpose = :purpose")
    int deleteBySubjectAndPurpose(@Param("subject") String subject,
                                  @Param("purpose") VerificationPurpose purpose);

    // consommées, ou émises avant la limite d'expiration
    @Modifying
    @Query("delete from VerificationSessionEntity s where s.consumedAt is not null or s.issuedAt <= :cutoff")
    int deleteStale(@Param("cutoff") Instant cutoff);
}
