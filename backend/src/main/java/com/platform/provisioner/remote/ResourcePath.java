package com.platform.provisioner.remote;

/**
 * Where a Management API call points: the session plus the identifiers of the enclosing resources.
 * A null identifier means the path stops above that level.
 */
public record ResourcePath(
        Session session,
        String accountId,
        String webPropertyId,
        String profileId,
        String itemId) {
    
    public static ResourcePath root(Session session) {
        return new ResourcePath(session, null, null, null, null);
    }
    
    public static ResourcePath account(Session session, String accountId) {
        return new ResourcePath(session, accountId, null, null, null);
    }
    
    public ResourcePath webProperty(String webPropertyId) {
        return new ResourcePath(session, accountId, webPropertyId, null, null);
    }
    
    public ResourcePath profile(String profileId) {
        return new ResourcePath(session, accountId, webPropertyId, profileId, null);
    }
    
    /**
     * Points at one custom dimension, custom metric or goal.
     */
    public ResourcePath item(String itemId) {
        return new ResourcePath(session, accountId, webPropertyId, profileId, itemId);
    }
    
    @Override
    public String toString() {
        StringBuilder path = new StringBuilder("accounts/").append(accountId);
        if (webPropertyId != null) {
            path.append("/webproperties/").append(webPropertyId);
        }
        if (profileId != null) {
            path.append("/profiles/").append(profileId);
        }
        if (itemId != null) {
            path.append("/").append(itemId);
        }
        return path.toString();
    }
}
