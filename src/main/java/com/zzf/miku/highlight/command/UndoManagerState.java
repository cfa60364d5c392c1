package com.zzf.miku.highlight.command;

import lombok.Value;

@Value
public class UndoManagerState {
    boolean canUndo;
    boolean canRedo;
    String undoDescription;
    String redoDescription;
    int undoStackSize;
    int redoStackSize;
}
