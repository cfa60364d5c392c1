package com.zzf.miku.highlight.command;

public interface UndoListener {

    default void onExecute(Command command) {
    }

    default void onUndo(Command command) {
    }

    default void onRedo(Command command) {
    }

    default void onStateChange(UndoManagerState state) {
    }
}
