package com.zzf.miku.highlight.state;

import lombok.Value;

import java.util.List;

@Value
public class TransitionResult {
    ManagerState state;
    List<SideEffect> sideEffects;

    public static TransitionResult of(ManagerState state, SideEffect... effects) {
        return new TransitionResult(state, List.of(effects));
    }
}
