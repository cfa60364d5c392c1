package com.zzf.miku.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether the review engine is switched on. Resolution order: runtime override, system
 * property {@value #SYSTEM_PROPERTY}, environment variable {@value #ENV_VAR}, then
 * {@code miku.highlight.enabled}.
 */
@Slf4j
@Component
public class HighlightFeatureFlags {
    public static final String SYSTEM_PROPERTY = "miku.highlight.enabled";
    public static final String ENV_VAR = "MIKU_NEW_HIGHLIGHT_MANAGER";

    private final HighlightProperties properties;
    private volatile Boolean override;

    public HighlightFeatureFlags(HighlightProperties properties) {
        this.properties = properties;
    }

    public boolean isEnabled() {
        Boolean o = override;
        if (o != null) {
            return o;
        }
        Boolean resolved = parse(System.getProperty(SYSTEM_PROPERTY));
        if (resolved == null) {
            resolved = parse(readEnv(ENV_VAR));
        }
        return resolved != null ? resolved : properties.isEnabled();
    }

    public Boolean getOverride() {
        return override;
    }

    /**
     * @param enabled the forced value, or null to fall back to configuration
     */
    public void setOverride(Boolean enabled) {
        log.info("feature.flag.override name={} value={}", SYSTEM_PROPERTY, enabled);
        this.override = enabled;
    }

    public void clearOverride() {
        setOverride(null);
    }

    String readEnv(String name) {
        return System.getenv(name);
    }

    /**
     * Only literal true/false count; anything else is treated as unset.
     */
    static Boolean parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(v)) {
            return Boolean.FALSE;
        }
        return null;
    }
}
