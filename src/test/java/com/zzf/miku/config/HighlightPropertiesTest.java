package com.zzf.miku.config;

import com.zzf.miku.highlight.session.ReviewSessionSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class HighlightPropertiesTest {

    @Test
    void mapsToSessionSettings() {
        HighlightProperties properties = new HighlightProperties();
        properties.setToolTimeoutMs(500);
        properties.setContinueOnError(false);
        properties.setMaxSuggestions(7);
        properties.setUndoRedoEnabled(false);

        ReviewSessionSettings settings = properties.toSessionSettings();

        assertEquals(500, settings.getExecutorOptions().getTimeoutMs());
        assertFalse(settings.getExecutorOptions().isContinueOnError());
        assertEquals(7, settings.getMaxSuggestions());
        assertFalse(settings.isUndoRedoEnabled());
        assertEquals(100, settings.getUndoMaxSize());
    }
}
