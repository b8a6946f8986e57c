package com.deliium.drawingboard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import com.deliium.drawingboard.auth.AccountService.Account;
import com.deliium.drawingboard.store.User;
import com.deliium.drawingboard.store.UserStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    UserStore users;

    PasswordEncoder encoder = new BCryptPasswordEncoder(4);

    AccountService service;

    @BeforeEach
    void setUp() {
        service = new AccountService(users, encoder);
    }

    private static HttpStatus statusOf(Throwable e) {
        return HttpStatus.valueOf(((ResponseStatusException) e).getStatusCode().value());
    }

    // ── register ────────────────────────────────────────────────────────────

    @Test
    void registerStoresNormalizedEmailAndHashedPassword() {
        when(users.findUserByEmail("ann@example.com")).thenReturn(Optional.empty());
        ArgumentCaptor<String> hash = ArgumentCaptor.forClass(String.class);
        when(users.createUser(eq("ann@example.com"), hash.capture())).thenReturn(12L);

        Account account = service.register("  Ann@Example.COM ", "secret");

        assertThat(account).isEqualTo(new Account(12L, "ann@example.com"));
        assertThat(hash.getValue()).isNotEqualTo("secret");
        assertThat(encoder.matches("secret", hash.getValue())).isTrue();
    }

    @Test
    void registerWithoutPasswordIsBadRequest() {
        assertThatThrownBy(() -> service.register("ann@example.com", ""))
            .isInstanceOf(ResponseStatusException.class)
            .satisfies(e -> assertThat(statusOf(e)).isEqualTo(HttpStatus.BAD_REQUEST));
        verify(users, never()).createUser(anyString(), anyString());
    }

    @Test
    void registerWithBlankEmailIsBadRequest() {
        assertThatThrownBy(() -> service.register("   ", "secret"))
            .satisfies(e -> assertThat(statusOf(e)).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void registerExistingEmailIsConflict() {
        when(users.findUserByEmail("ann@example.com"))
            .thenReturn(Optional.of(new User(1L, "ann@example.com", "h", Instant.EPOCH)));

        assertThatThrownBy(() -> service.register("ann@example.com", "secret"))
            .satisfies(e -> assertThat(statusOf(e)).isEqualTo(HttpStatus.CONFLICT));
    }

    @Test
    void concurrentDuplicateIsConflict() {
        when(users.findUserByEmail("ann@example.com")).thenReturn(Optional.empty());
        when(users.createUser(eq("ann@example.com"), anyString())).thenThrow(new DuplicateKeyException("dup"));

        assertThatThrownBy(() -> service.register("ann@example.com", "secret"))
            .satisfies(e -> assertThat(statusOf(e)).isEqualTo(HttpStatus.CONFLICT));
    }

    // ── login ───────────────────────────────────────────────────────────────

    @Test
    void loginWithCorrectPassword() {
        when(users.findUserByEmail("ann@example.com"))
            .thenReturn(Optional.of(new User(3L, "ann@example.com", encoder.encode("secret"), Instant.EPOCH)));

        assertThat(service.login("ANN@example.com", "secret")).isEqualTo(new Account(3L, "ann@example.com"));
    }

    @Test
    void loginWithWrongPasswordIsUnauthorized() {
        when(users.findUserByEmail("ann@example.com"))
            .thenReturn(Optional.of(new User(3L, "ann@example.com", encoder.encode("secret"), Instant.EPOCH)));

        assertThatThrownBy(() -> service.login("ann@example.com", "nope"))
            .satisfies(e -> assertThat(statusOf(e)).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    @Test
    void loginUnknownEmailIsUnauthorized() {
        when(users.findUserByEmail("who@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.login("who@example.com", "secret"))
            .satisfies(e -> assertThat(statusOf(e)).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    // ── find ────────────────────────────────────────────────────────────────

    @Test
    void findMapsUserToAccount() {
        when(users.findUserById(3L)).thenReturn(Optional.of(new User(3L, "ann@example.com", "h", Instant.EPOCH)));

        assertThat(service.find(3L)).contains(new Account(3L, "ann@example.com"));
    }
}
