package com.bikerly.api;

import com.bikerly.config.OpenApiConfig;
import com.bikerly.security.BearerAuthInterceptor;
import com.bikerly.security.RequireRole;
import com.bikerly.shared.dto.UserPublic;
import com.bikerly.shared.model.Role;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Bearer-protected user endpoints. Authentication happens in {@link BearerAuthInterceptor}.
 */
@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "Profile endpoints")
@SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
public class UserController {

    private static final Logger logger = LoggerFactory.getLogger(UserController.class);

    @GetMapping("/me")
    @Operation(summary = "Current user's profile")
    public ResponseEntity<UserPublic> me(
            @RequestAttribute(BearerAuthInterceptor.CURRENT_USER_ATTRIBUTE) UserPublic currentUser) {
        logger.info("User profile accessed: {}", currentUser.getEmail());
        return ResponseEntity.ok(currentUser);
    }

    @GetMapping("/admin-only")
    @RequireRole(Role.ADMIN)
    @Operation(summary = "Admin-only endpoint", description = "Requires admin role")
    public ResponseEntity<Map<String, String>> adminOnly(
            @RequestAttribute(BearerAuthInterceptor.CURRENT_USER_ATTRIBUTE) UserPublic currentUser) {
        logger.info("Admin endpoint accessed by: {}", currentUser.getEmail());
        return ResponseEntity.ok(Map.of("message", "Hello admin " + currentUser.getEmail()));
    }
}
