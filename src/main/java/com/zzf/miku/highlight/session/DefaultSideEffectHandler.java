package com.zzf.miku.highlight.session;

import com.zzf.miku.highlight.state.SideEffect;
import com.zzf.miku.highlight.store.StoreAction;
import lombok.extern.slf4j.Slf4j;

/**
 * Performs store-level effects and forwards review start/cancel to an optional {@link ReviewTrigger}.
 * <p>
 * {@code APPLY_SUGGESTION} and {@code UPDATE_POSITIONS} are already carried out by the session before
 * it raises the corresponding event, so they are only logged here.
 */
@Slf4j
public class DefaultSideEffectHandler implements SideEffectHandler {
    private final ReviewTrigger trigger;

    public DefaultSideEffectHandler() {
        this(null);
    }

    public DefaultSideEffectHandler(ReviewTrigger trigger) {
        this.trigger = trigger;
    }

    @Override
    public void handle(SideEffect effect, ReviewSession session) {
        switch (effect.getType()) {
            case START_REVIEW:
                if (trigger != null) {
                    trigger.startReview(session);
                }
                break;
            case CANCEL_REVIEW:
                session.abortPendingTools("review cancelled");
                if (trigger != null) {
                    trigger.cancelReview(session);
                }
                break;
            case CLEAR_ALL_SUGGESTIONS:
                if (!session.getStore().getState().getHighlights().isEmpty()) {
                    session.getStore().dispatch(StoreAction.removeAll());
                }
                break;
            case REMOVE_SUGGESTION:
                session.getStore().dispatch(StoreAction.remove(effect.getSuggestionId()));
                break;
            case LOG_ERROR:
                log.warn("session.error sessionId={} err={}", session.getId(), effect.getError());
                break;
            case APPLY_SUGGESTION:
            case UPDATE_POSITIONS:
            default:
                log.debug("session.effect sessionId={} effect={}", session.getId(), effect);
                break;
        }
    }
}
