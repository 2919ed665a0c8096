package com.bikerly.shared.dto;

import com.bikerly.shared.model.Role;
import com.bikerly.shared.model.User;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Public view of a user account; everything except the password hash.
 * This is also the resolved identity handed to role checks.
 */
public class UserPublic {

    private String id;
    private String uuid;
    private String email;
    private String userName;
    private String phoneNumber;
    private String countryCode;
    private String name;
    private String displayName;
    private Role role;
    private boolean active;
    private boolean verified;
    private String profilePictureUrl;
    private String bio;
    private String website;
    private String location;
    private Map<String, String> socialLinks;
    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;
    private String updatedBy;

    public UserPublic() {
    }

    public static UserPublic from(User user) {
        UserPublic view = new UserPublic();
        view.id = user.getId();
        view.uuid = user.getUuid();
        view.email = user.getEmail();
        view.userName = user.getUserName();
        view.phoneNumber = user.getPhoneNumber();
        view.countryCode = user.getCountryCode();
        view.name = user.getName();
        view.displayName = user.getDisplayName();
        view.role = user.getRole();
        view.active = user.isActive();
        view.verified = user.isVerified();
        view.profilePictureUrl = user.getProfilePictureUrl();
        view.bio = user.getBio();
        view.website = user.getWebsite();
        view.location = user.getLocation();
        view.socialLinks = user.getSocialLinks();
        view.createdAt = user.getCreatedAt();
        view.updatedAt = user.getUpdatedAt();
        view.createdBy = user.getCreatedBy();
        view.updatedBy = user.getUpdatedBy();
        return view;
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

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Role getRole() {
        return role;
    }

    @JsonProperty("is_active")
    public boolean isActive() {
        return active;
    }

    @JsonProperty("is_verified")
    public boolean isVerified() {
        return verified;
    }

    public String getProfilePictureUrl() {
        return profilePictureUrl;
    }

    public String getBio() {
        return bio;
    }

    public String getWebsite() {
        return website;
    }

    public String getLocation() {
        return location;
    }

    public Map<String, String> getSocialLinks() {
        return socialLinks;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }
}
