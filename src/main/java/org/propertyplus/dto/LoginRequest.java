package org.propertyplus.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {
    // nom d'utilisateur ou e-mail
    @NotBlank
    private String login;
    @NotBlank
    private String password;
}
