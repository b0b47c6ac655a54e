package com.newsagent.cache;

import java.util.Locale;

/**
 * Whether this deployment may keep state on the local filesystem.
 */
public enum DeploymentMode {

    /** Development and staging: local files allowed. */
    SERVICES_ENABLED,

    /** Production: nothing may be written locally. */
    SERVICES_RESTRICTED;

    public static DeploymentMode fromSetting(String value) {
        if (value == null || value.isBlank()) {
            return SERVICES_ENABLED;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "development", "dev", "local", "test", "staging", "services-enabled" -> SERVICES_ENABLED;
            case "production", "prod", "services-restricted" -> SERVICES_RESTRICTED;
            default -> throw new IllegalArgumentException("Unknown deployment mode: " + value);
        };
    }
}
