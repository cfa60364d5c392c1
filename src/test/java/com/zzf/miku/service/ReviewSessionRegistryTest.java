package com.zzf.miku.service;

import com.zzf.miku.config.HighlightProperties;
import com.zzf.miku.highlight.error.ReviewSessionNotFoundException;
import com.zzf.miku.highlight.session.ReviewSession;
import com.zzf.miku.highlight.session.ReviewTrigger;
import com.zzf.miku.highlight.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ReviewSessionRegistryTest {

    private final HighlightProperties properties = new HighlightProperties();

    @Test
    void createGetRemove() {
        ReviewSessionRegistry registry = new ReviewSessionRegistry(ToolRegistry.createDefault(), properties);

        ReviewSession session = registry.create("hello");

        assertTrue(session.getId().startsWith("review-"));
        assertEquals("hello", session.getDocument());
        assertSame(session, registry.get(session.getId()));
        assertTrue(registry.remove(session.getId()));
        assertFalse(registry.remove(session.getId()));

        ReviewSessionNotFoundException e = assertThrows(ReviewSessionNotFoundException.class,
                () -> registry.get(session.getId()));
        assertEquals("SESSION_NOT_FOUND", e.getCode());
    }

    @Test
    void evictsOldestWhenFull() throws InterruptedException {
        properties.setMaxSessions(2);
        ReviewSessionRegistry registry = new ReviewSessionRegistry(ToolRegistry.createDefault(), properties);

        ReviewSession first = registry.create("a");
        Thread.sleep(5);
        ReviewSession second = registry.create("b");
        Thread.sleep(5);
        ReviewSession third = registry.create("c");

        assertEquals(2, registry.size());
        assertFalse(registry.ids().contains(first.getId()));
        assertTrue(registry.ids().contains(second.getId()));
        assertTrue(registry.ids().contains(third.getId()));
    }

    @Test
    void sessionsUseConfiguredTrigger() {
        ReviewTrigger trigger = mock(ReviewTrigger.class);
        ReviewSessionRegistry registry = new ReviewSessionRegistry(ToolRegistry.createDefault(), properties, trigger);

        ReviewSession session = registry.create(null);
        session.requestReview();

        assertEquals("", session.getDocument());
        verify(trigger).startReview(session);
    }
}
