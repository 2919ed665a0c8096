package com.bikerly.shared.dto;

/**
 * OAuth2-style bearer token response (access_token, token_type).
 */
public class TokenResponse {

    private String accessToken;
    private String tokenType = "bearer";

    public TokenResponse() {
    }

    public TokenResponse(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public void setTokenType(String tokenType) {
        this.tokenType = tokenType;
    }
}
