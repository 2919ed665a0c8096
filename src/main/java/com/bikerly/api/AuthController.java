package com.bikerly.api;

import com.bikerly.security.AuthService;
import com.bikerly.shared.dto.RegisterRequest;
import com.bikerly.shared.dto.RegisterResponse;
import com.bikerly.shared.dto.TokenResponse;
import com.bikerly.shared.model.User;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration and login. Per-endpoint rate limits are applied by {@link com.bikerly.security.RateLimitFilter}
 * before the body or form is bound.
 */
@RestController
@RequestMapping("/api/auth")
@Tag(name = "Auth", description = "Registration and login endpoints")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register a new user",
               description = "Creates a rider account. Rate limited to 5 requests per minute per client")
    public ResponseEntity<RegisterResponse> register(
            @Valid @RequestBody RegisterRequest registerRequest) {
        User user = authService.register(registerRequest);
        return ResponseEntity.status(HttpStatus.CREATED).body(RegisterResponse.from(user));
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Log in",
               description = "OAuth2 password form (username = email). Rate limited to 10 requests per minute per client")
    public ResponseEntity<TokenResponse> login(
            @RequestParam("username") String username,
            @RequestParam("password") String password) {
        String token = authService.login(username, password);
        return ResponseEntity.ok(new TokenResponse(token));
    }
}
