package org.propertyplus.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "account")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Account {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String username;

    // toujours stocké en minuscules
    @Column(unique = true, nullable = false)
    private String email;

    @Column(nullable = false)
    private String passwordHash;

    private String fullName;

    private String contactNumber;

    private String city;

    private String state;

    // "Buyer" ou "Seller"
    @Column(nullable = false)
    @Builder.Default
    private String role = "Buyer";

    // activée par défaut à l'inscription
    @Builder.Default
    private boolean twoFactorEnabled = true;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    private LocalDateTime lastPasswordUpdate;
}
