package com.zzf.miku.highlight.command;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Bounded undo/redo history.
 * <p>
 * {@link #execute(Command)} runs a command, pushes it on the undo stack and clears redo; when the
 * stack grows past {@code maxSize} the oldest entry is evicted. A command whose undo or redo throws
 * goes back on the stack it came from before the exception propagates. Calling execute, undo or redo
 * from inside a running command is rejected with {@link IllegalStateException}.
 */
@Slf4j
public class UndoManager {
    public static final int DEFAULT_MAX_SIZE = 100;

    private final Deque<Command> undoStack = new ArrayDeque<>();
    private final Deque<Command> redoStack = new ArrayDeque<>();
    private final List<UndoListener> listeners = new CopyOnWriteArrayList<>();
    private volatile int maxSize;
    private boolean executing;

    public UndoManager() {
        this(DEFAULT_MAX_SIZE);
    }

    public UndoManager(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public void addListener(UndoListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(UndoListener listener) {
        listeners.remove(listener);
    }

    public void setMaxSize(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        trim();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void execute(Command command) {
        if (executing) {
            throw new IllegalStateException("Cannot execute command while another command is executing");
        }
        executing = true;
        try {
            command.execute();
            undoStack.push(command);
            redoStack.clear();
            trim();
            log.debug("undo.execute type={} id={} undoSize={}", command.getType(), command.getId(), undoStack.size());
            listeners.forEach(l -> l.onExecute(command));
            fireStateChange();
        } finally {
            executing = false;
        }
    }

    /**
     * @return false when there was nothing to undo
     */
    public boolean undo() {
        if (executing) {
            throw new IllegalStateException("Cannot undo while a command is executing");
        }
        Command command = undoStack.poll();
        if (command == null) {
            return false;
        }
        executing = true;
        try {
            command.undo();
            redoStack.push(command);
        } catch (RuntimeException e) {
            undoStack.push(command);
            log.warn("undo.failed type={} id={} err={}", command.getType(), command.getId(), e.getMessage());
            throw e;
        } finally {
            executing = false;
        }
        listeners.forEach(l -> l.onUndo(command));
        fireStateChange();
        return true;
    }

    /**
     * @return false when there was nothing to redo
     */
    public boolean redo() {
        if (executing) {
            throw new IllegalStateException("Cannot redo while a command is executing");
        }
        Command command = redoStack.poll();
        if (command == null) {
            return false;
        }
        executing = true;
        try {
            command.execute();
            undoStack.push(command);
            trim();
        } catch (RuntimeException e) {
            redoStack.push(command);
            log.warn("redo.failed type={} id={} err={}", command.getType(), command.getId(), e.getMessage());
            throw e;
        } finally {
            executing = false;
        }
        listeners.forEach(l -> l.onRedo(command));
        fireStateChange();
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public String getUndoDescription() {
        Command top = undoStack.peek();
        return top == null ? null : top.getDescription();
    }

    public String getRedoDescription() {
        Command top = redoStack.peek();
        return top == null ? null : top.getDescription();
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
        fireStateChange();
    }

    public UndoManagerState getState() {
        return new UndoManagerState(canUndo(), canRedo(), getUndoDescription(), getRedoDescription(),
                undoStack.size(), redoStack.size());
    }

    public int getUndoStackSize() {
        return undoStack.size();
    }

    public int getRedoStackSize() {
        return redoStack.size();
    }

    /**
     * @return a copy, most recent command first
     */
    public List<Command> getUndoStack() {
        return new ArrayList<>(undoStack);
    }

    /**
     * @return a copy, most recent command first
     */
    public List<Command> getRedoStack() {
        return new ArrayList<>(redoStack);
    }

    public int undoMultiple(int count) {
        int undone = 0;
        while (undone < count && undo()) {
            undone++;
        }
        return undone;
    }

    public int redoMultiple(int count) {
        int redone = 0;
        while (redone < count && redo()) {
            redone++;
        }
        return redone;
    }

    /**
     * Undoes until the next command to undo has the given type. That command stays on the stack.
     */
    public int undoUntilType(String type) {
        int undone = 0;
        while (canUndo() && !Objects.equals(undoStack.peek().getType(), type)) {
            undo();
            undone++;
        }
        return undone;
    }

    /**
     * Unwinds the stack down to and including the oldest command tagged with {@code groupId}.
     * Commands stacked on top of group members are undone along the way.
     */
    public int undoGroup(String groupId) {
        int depth = -1;
        int i = 0;
        for (Command command : undoStack) {
            if (groupId != null && groupId.equals(command.getGroupId())) {
                depth = i;
            }
            i++;
        }
        int undone = 0;
        while (undone <= depth && undo()) {
            undone++;
        }
        return undone;
    }

    public boolean isInProgress() {
        return executing;
    }

    private void trim() {
        while (undoStack.size() > maxSize) {
            Iterator<Command> oldest = undoStack.descendingIterator();
            Command evicted = oldest.next();
            oldest.remove();
            log.debug("undo.evict type={} id={}", evicted.getType(), evicted.getId());
        }
    }

    private void fireStateChange() {
        UndoManagerState state = getState();
        listeners.forEach(l -> l.onStateChange(state));
    }
}
