package com.deliium.drawingboard.web;

import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;

import com.deliium.drawingboard.auth.AccountService;
import com.deliium.drawingboard.auth.AccountService.Account;
import com.deliium.drawingboard.auth.HttpSessionIdentityResolver;
import com.deliium.drawingboard.auth.IdentityResolver;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/** Account endpoints. A successful register or login stores the user id in the servlet session. */
@RestController
@RequestMapping("/api")
public class AuthController {

    private final AccountService accounts;
    private final IdentityResolver identity;

    public AuthController(AccountService accounts, IdentityResolver identity) {
        this.accounts = accounts;
        this.identity = identity;
    }

    public record Credentials(String email, String password) {}

    public record UserView(long id, String email) {}

    @PostMapping("/register")
    public UserView register(@RequestBody(required = false) Credentials credentials, HttpServletRequest request) {
        if (credentials == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "bad json");
        }
        Account account = accounts.register(credentials.email(), credentials.password());
        startSession(request, account.id());
        return new UserView(account.id(), account.email());
    }

    @PostMapping("/login")
    public UserView login(@RequestBody(required = false) Credentials credentials, HttpServletRequest request) {
        if (credentials == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "bad json");
        }
        Account account = accounts.login(credentials.email(), credentials.password());
        startSession(request, account.id());
        return new UserView(account.id(), account.email());
    }

    @PostMapping("/logout")
    public Map<String, Object> logout(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }
        return Map.of("ok", true);
    }

    @GetMapping("/me")
    public UserView me(HttpServletRequest request) {
        long userId = identity.resolve(request)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "unauthorized"));
        Account account = accounts.find(userId)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "unauthorized"));
        return new UserView(account.id(), account.email());
    }

    private static void startSession(HttpServletRequest request, long userId) {
        if (request.getSession(false) != null) {
            request.changeSessionId();
        }
        request.getSession(true).setAttribute(HttpSessionIdentityResolver.USER_ID_ATTRIBUTE, userId);
    }
}
