package org.propertyplus.model;

import jakarta.persistence.*;
import lombok.*;
import org.propertyplus.verification.VerificationPurpose;

import java.time.Instant;

@Entity
@Table(name = "verification_session",
        uniqueConstraints = @UniqueConstraint(name = "uk_verification_subject_purpose", columnNames = {"subject", "purpose"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerificationSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String subject;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private VerificationPurpose purpose;

    // null quand la session a été ouverte par le mot de passe actuel
    @Column(length = 9)
    private String code;

    @Column(nullable = false)
    private Instant issuedAt;

    private Instant verifiedAt;

    private Instant consumedAt;

    @Column(nullable = false)
    private int failedAttempts;
}
