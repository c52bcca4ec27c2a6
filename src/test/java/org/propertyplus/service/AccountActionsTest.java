package org.propertyplus.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.propertyplus.dto.RegisterRequest;
import org.propertyplus.model.Account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountActionsTest {

    @Mock
    private AccountService accountService;

    @Mock
    private NotificationService notifications;

    @InjectMocks
    private AccountActions actions;

    private Account account() {
        return Account.builder().email("john@example.com").username("jdoe").build();
    }

    @Test
    void register_shouldCreateAccount_andSendWelcome() {
        RegisterRequest req = new RegisterRequest("john@example.com", "jdoe", "Secret123", null, null, null);
        Account a = account();
        when(accountService.register("john@example.com", req)).thenReturn(a);

        Account created = actions.register().perform("john@example.com", req);

        assertThat(created).isSameAs(a);
        verify(notifications).sendWelcome("john@example.com", "jdoe");
    }

    @Test
    void register_shouldRefuseTakenUsername() {
        RegisterRequest req = new RegisterRequest("john@example.com", "jdoe", "Secret123", null, null, null);
        when(accountService.isUsernameTaken("jdoe")).thenReturn(true);

        assertThat(actions.register().refuse("john@example.com", req)).contains("Username already taken");
    }

    @Test
    void changePassword_shouldRefuseSamePassword() {
        when(accountService.passwordMatches("john@example.com", "Same123")).thenReturn(true);
        when(accountService.passwordMatches("john@example.com", "Other123")).thenReturn(false);

        assertThat(actions.changePassword().refuse("john@example.com", "Same123"))
                .contains("New password cannot be the same as your old password");
        assertThat(actions.changePassword().refuse("john@example.com", "Other123")).isEmpty();
    }

    @Test
    void resetPassword_shouldNotApplySameness() {
        Account a = account();
        when(accountService.updatePassword("john@example.com", "New123")).thenReturn(a);

        assertThat(actions.resetPassword().refuse("john@example.com", "New123")).isEmpty();
        assertThat(actions.resetPassword().perform("john@example.com", "New123")).isSameAs(a);
        verify(accountService, never()).passwordMatches(anyString(), anyString());
    }

    @Test
    void setTwoFactor_shouldDelegate() {
        Account a = account();
        when(accountService.setTwoFactor("john@example.com", false)).thenReturn(a);

        assertThat(actions.setTwoFactor().perform("john@example.com", false)).isSameAs(a);
    }

    @Test
    void deleteAccount_shouldDelete_andSendFarewell() {
        when(accountService.delete("john@example.com")).thenReturn(account());

        actions.deleteAccount().perform("john@example.com", null);

        verify(notifications).sendAccountDeleted("john@example.com", "jdoe");
    }
}
