package com.zzf.miku.service;

import com.zzf.miku.config.HighlightProperties;
import com.zzf.miku.highlight.error.ReviewSessionNotFoundException;
import com.zzf.miku.highlight.session.DefaultSideEffectHandler;
import com.zzf.miku.highlight.session.ReviewSession;
import com.zzf.miku.highlight.session.ReviewTrigger;
import com.zzf.miku.highlight.text.InMemoryDocument;
import com.zzf.miku.highlight.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sessions for the REST adapter. When full, creating a session evicts the oldest one.
 */
@Slf4j
@Service
public class ReviewSessionRegistry {
    private final Map<String, ReviewSession> sessions = new ConcurrentHashMap<>();
    private final ToolRegistry toolRegistry;
    private final HighlightProperties properties;
    private final ReviewTrigger trigger;

    public ReviewSessionRegistry(ToolRegistry toolRegistry, HighlightProperties properties) {
        this(toolRegistry, properties, null);
    }

    @Autowired
    public ReviewSessionRegistry(ToolRegistry toolRegistry, HighlightProperties properties, @Nullable ReviewTrigger trigger) {
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.trigger = trigger;
    }

    public synchronized ReviewSession create(String content) {
        while (sessions.size() >= Math.max(1, properties.getMaxSessions())) {
            sessions.values().stream()
                    .min(Comparator.comparingLong(ReviewSession::getCreatedAt))
                    .ifPresent(oldest -> {
                        sessions.remove(oldest.getId());
                        log.info("session.evicted sessionId={}", oldest.getId());
                    });
        }
        String id = "review-" + UUID.randomUUID();
        ReviewSession session = new ReviewSession(id, new InMemoryDocument(content == null ? "" : content), toolRegistry,
                properties.toSessionSettings(), new DefaultSideEffectHandler(trigger));
        sessions.put(id, session);
        log.info("session.created sessionId={} chars={}", id, session.getDocument().length());
        return session;
    }

    /**
     * @throws ReviewSessionNotFoundException when the id is unknown
     */
    public ReviewSession get(String id) {
        ReviewSession session = id == null ? null : sessions.get(id);
        if (session == null) {
            throw new ReviewSessionNotFoundException(id);
        }
        return session;
    }

    public boolean remove(String id) {
        ReviewSession removed = id == null ? null : sessions.remove(id);
        if (removed != null) {
            removed.abortPendingTools("session closed");
            log.info("session.removed sessionId={}", id);
        }
        return removed != null;
    }

    public List<String> ids() {
        return List.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }
}
