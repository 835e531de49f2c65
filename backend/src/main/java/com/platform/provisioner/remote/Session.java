package com.platform.provisioner.remote;

import java.util.Objects;

/**
 * Credentials for one caller of the Management API.
 *
 * @param accessToken OAuth2 bearer token
 * @param quotaUser   optional per-user quota bucket, sent as the {@code quotaUser} query parameter
 */
public record Session(String accessToken, String quotaUser) {
    
    public Session {
        Objects.requireNonNull(accessToken, "accessToken");
    }
    
    public static Session bearer(String accessToken) {
        return new Session(accessToken, null);
    }
    
    public String authorizationHeader() {
        return "Bearer " + accessToken;
    }
    
    @Override
    public String toString() {
        String masked = accessToken.length() <= 4 ? "****" : accessToken.substring(0, 4) + "****";
        return "Session[accessToken=" + masked + ", quotaUser=" + quotaUser + "]";
    }
}
