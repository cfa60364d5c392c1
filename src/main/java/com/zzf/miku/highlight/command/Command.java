package com.zzf.miku.highlight.command;

import java.util.List;

/**
 * A reversible unit of work recorded by {@link UndoManager}.
 */
public interface Command {

    String getType();

    String getDescription();

    long getCreatedAt();

    void execute();

    void undo();

    default String getId() {
        return null;
    }

    default String getGroupId() {
        return null;
    }

    default List<String> getTags() {
        return List.of();
    }
}
