package org.propertyplus.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.propertyplus.model.Account;
import org.propertyplus.repo.AccountRepository;
import org.propertyplus.service.MailService;
import org.propertyplus.verification.CodeGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Parcours HTTP complets : inscription, mot de passe oublié, réglages, suppression.
 * Le mail est simulé et les codes sont fixés.
 */
@SpringBootTest
@AutoConfigureMockMvc
class AccountVerificationFlowTest {

    private static final String CODE = "123456";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountRepository accountRepository;

    @MockBean
    private MailService mailService;

    @MockBean
    private CodeGenerator codeGenerator;

    @BeforeEach
    void setUp() {
        when(codeGenerator.generate()).thenReturn(CODE);
    }

    private ResultActions postJson(String url, Object body) throws Exception {
        return mockMvc.perform(post(url)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private ResultActions postAuth(String url, String token, Object body) throws Exception {
        return mockMvc.perform(post(url)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private Map<String, Object> json(MvcResult result) throws Exception {
        return objectMapper.readValue(result.getResponse().getContentAsString(), new TypeReference<>() {});
    }

    private String signup(String email, String username, String password) throws Exception {
        postJson("/api/auth/signup/send-code", Map.of("email", email)).andExpect(status().isOk());
        postJson("/api/auth/signup/verify", Map.of("email", email, "otp", CODE)).andExpect(status().isOk());
        MvcResult res = postJson("/api/auth/register", Map.of(
                "email", email, "username", username, "password", password, "role", "Buyer"))
                .andExpect(status().isOk())
                .andReturn();
        return (String) json(res).get("token");
    }

    @Test
    void signup_shouldRequireVerifiedCode_andRegisterOnlyOnce() throws Exception {
        String email = "flow-signup@example.com";

        postJson("/api/auth/signup/send-code", Map.of("email", email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.otpRequired").value(true))
                .andExpect(jsonPath("$.expiresIn").value(600));
        verify(mailService).send(eq(email), eq("Your Verification Code - PropertyPlus"), contains(CODE));

        Map<String, String> registration = Map.of(
                "email", email, "username", "flowsignup", "password", "Secret123");

        postJson("/api/auth/register", registration)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NOT_VERIFIED"));

        postJson("/api/auth/signup/verify", Map.of("email", email, "otp", "000000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid OTP"));

        postJson("/api/auth/signup/verify", Map.of("email", email, "otp", CODE))
                .andExpect(status().isOk());

        postJson("/api/auth/register", registration)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").isNotEmpty())
                .andExpect(jsonPath("$.username").value("flowsignup"));
        verify(mailService).send(eq(email), eq("Welcome to the Family!"), anyString());

        // l'e-mail est désormais pris
        postJson("/api/auth/register", registration)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PRECONDITION_FAILED"));

        assertThat(accountRepository.findByEmailIgnoreCase(email)).isPresent();
    }

    @Test
    void forgotPassword_shouldResetOnce_andAllowLoginWithNewPassword() throws Exception {
        String email = "flow-reset@example.com";
        signup(email, "flowreset", "OldPass1");

        postJson("/api/auth/forgot/send-code", Map.of("email", "nobody@example.com"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Email not registered"));

        postJson("/api/auth/forgot/send-code", Map.of("email", email)).andExpect(status().isOk());
        postJson("/api/auth/forgot/verify", Map.of("email", email, "otp", CODE)).andExpect(status().isOk());
        postJson("/api/auth/forgot/reset", Map.of("email", email, "newPassword", "NewPass1"))
                .andExpect(status().isOk());
        verify(mailService).send(eq(email), eq("Your Password Has Been Updated"), anyString());

        postJson("/api/auth/forgot/reset", Map.of("email", email, "newPassword", "Other123"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ALREADY_CONSUMED"));

        postJson("/api/auth/login", Map.of("login", "flowreset", "password", "OldPass1"))
                .andExpect(status().isUnauthorized());
        postJson("/api/auth/login", Map.of("login", email, "password", "NewPass1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").isNotEmpty());
    }

    @Test
    void settings_shouldRejectAnonymousCalls() throws Exception {
        mockMvc.perform(post("/api/settings/password/request"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void passwordChange_shouldUseCode_whileTwoFactorEnabled() throws Exception {
        String email = "flow-change@example.com";
        String token = signup(email, "flowchange", "OldPass1");

        postAuth("/api/settings/password/request", token, Map.of())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.otpRequired").value(true));

        postAuth("/api/settings/password/verify-current", token, Map.of("password", "OldPass1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PRECONDITION_FAILED"));

        postAuth("/api/settings/password/finalize", token, Map.of("otp", CODE, "newPassword", "OldPass1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("New password cannot be the same as your old password"));

        postAuth("/api/settings/password/finalize", token, Map.of("newPassword", "NewPass1"))
                .andExpect(status().isOk());

        postJson("/api/auth/login", Map.of("login", "flowchange", "password", "NewPass1"))
                .andExpect(status().isOk());
    }

    @Test
    void twoFactorDisable_thenPasswordChange_shouldUseCurrentPassword() throws Exception {
        String email = "flow-2fa@example.com";
        String token = signup(email, "flow2fa", "OldPass1");

        postAuth("/api/settings/two-factor/request", token, Map.of()).andExpect(status().isOk());
        verify(mailService).send(eq(email), eq("2FA DISABLE - PropertyPlus"), contains(CODE));

        // mot de passe exigé même après le code
        postAuth("/api/settings/two-factor/verify-code", token, Map.of("otp", CODE)).andExpect(status().isOk());
        postAuth("/api/settings/two-factor/finalize", token, Map.of("enabled", false, "password", "nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Incorrect password"));
        postAuth("/api/settings/two-factor/finalize", token, Map.of("enabled", false, "password", "OldPass1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));

        assertThat(accountRepository.findByEmailIgnoreCase(email).orElseThrow().isTwoFactorEnabled()).isFalse();

        postAuth("/api/settings/password/request", token, Map.of())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.otpRequired").value(false));
        postAuth("/api/settings/password/verify-current", token, Map.of("password", "OldPass1"))
                .andExpect(status().isOk());
        postAuth("/api/settings/password/finalize", token, Map.of("newPassword", "NewPass1"))
                .andExpect(status().isOk());

        // réactivation : mot de passe seul
        postAuth("/api/settings/two-factor/finalize", token, Map.of("enabled", true, "password", "NewPass1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true));
    }

    @Test
    void accountDeletion_shouldNeedCodeAndPassword_andRemoveAccount() throws Exception {
        String email = "flow-delete@example.com";
        String token = signup(email, "flowdelete", "Secret123");

        // sans code : aucune indication sur le mot de passe
        postAuth("/api/settings/delete/finalize", token, Map.of("password", "wrong"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NO_ACTIVE_SESSION"));

        postAuth("/api/settings/delete/request", token, Map.of()).andExpect(status().isOk());

        postAuth("/api/settings/delete/finalize", token, Map.of("password", "wrong"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NOT_VERIFIED"));
        postAuth("/api/settings/delete/finalize", token, Map.of("password", "Secret123"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NOT_VERIFIED"));

        postAuth("/api/settings/delete/verify-code", token, Map.of("otp", CODE)).andExpect(status().isOk());
        postAuth("/api/settings/delete/finalize", token, Map.of("password", "Secret123"))
                .andExpect(status().isOk());

        verify(mailService).send(eq(email), eq("Account Deleted - PropertyPlus"), anyString());
        assertThat(accountRepository.findByEmailIgnoreCase(email)).isEmpty();

        postJson("/api/auth/login", Map.of("login", "flowdelete", "password", "Secret123"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void profileDetails_shouldNeedCurrentPassword() throws Exception {
        String email = "flow-profile@example.com";
        String token = signup(email, "flowprofile", "Secret123");

        postAuth("/api/settings/profile", token, Map.of("password", "nope", "city", "Pune"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Incorrect password"));
        assertThat(accountRepository.findByEmailIgnoreCase(email).orElseThrow().getCity()).isNull();

        postAuth("/api/settings/profile", token, Map.of(
                "password", "Secret123", "contactNumber", "9876543210", "city", "Pune", "state", "Maharashtra"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.city").value("Pune"));

        Account a = accountRepository.findByEmailIgnoreCase(email).orElseThrow();
        assertThat(a.getContactNumber()).isEqualTo("9876543210");
        assertThat(a.getState()).isEqualTo("Maharashtra");
    }

    @Test
    void invalidBody_shouldReturn400WithFieldMessage() throws Exception {
        postJson("/api/auth/signup/send-code", Map.of("email", "not-an-email"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }
}
