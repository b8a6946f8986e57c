package com.deliium.drawingboard.auth;

import java.util.Locale;
import java.util.Optional;

import com.deliium.drawingboard.store.User;
import com.deliium.drawingboard.store.UserStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/** Registration and credential checks. Session handling stays in the web layer. */
@Service
public class AccountService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AccountService.class);

    private final UserStore users;
    private final PasswordEncoder passwordEncoder;

    public AccountService(UserStore users, PasswordEncoder passwordEncoder) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
    }

    public record Account(long id, String email) {}

    public Account register(String email, String password) {
        String normalized = normalizeEmail(email);
        if (normalized.isEmpty() || password == null || password.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "missing fields");
        }
        if (users.findUserByEmail(normalized).isPresent()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "email exists");
        }
        long id;
        try {
            id = users.createUser(normalized, passwordEncoder.encode(password));
        } catch (DuplicateKeyException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "email exists");
        }
        LOGGER.info("Account registered: id={}", id);
        return new Account(id, normalized);
    }

    public Account login(String email, String password) {
        Optional<User> user = users.findUserByEmail(normalizeEmail(email));
        if (user.isEmpty() || password == null || !passwordEncoder.matches(password, user.get().passwordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "invalid credentials");
        }
        return new Account(user.get().id(), user.get().email());
    }

    public Optional<Account> find(long userId) {
        return users.findUserById(userId).map(u -> new Account(u.id(), u.email()));
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
