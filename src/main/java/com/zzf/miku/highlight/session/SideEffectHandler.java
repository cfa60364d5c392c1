package com.zzf.miku.highlight.session;

import com.zzf.miku.highlight.state.SideEffect;

@FunctionalInterface
public interface SideEffectHandler {

    void handle(SideEffect effect, ReviewSession session);
}
