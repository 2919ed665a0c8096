package com.bikerly.shared.dto;

import com.bikerly.shared.model.Role;
import com.bikerly.shared.model.User;

/**
 * Response DTO for a created account: public identifiers and role only.
 */
public class RegisterResponse {

    private String id;
    private String uuid;
    private String email;
    private String userName;
    private String displayName;
    private Role role;

    public RegisterResponse() {
    }

    public static RegisterResponse from(User user) {
        RegisterResponse response = new RegisterResponse();
        response.id = user.getId();
        response.uuid = user.getUuid();
        response.email = user.getEmail();
        response.userName = user.getUserName();
        response.displayName = user.getDisplayName();
        response.role = user.getRole();
        return response;
    }

    public String getId() {
        return id;
    }

    public String getUuid() {
        return uuid;
    }

    public String getEmail() {
        return email;
    }

    public String getUserName() {
        return userName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Role getRole() {
        return role;
    }
}
