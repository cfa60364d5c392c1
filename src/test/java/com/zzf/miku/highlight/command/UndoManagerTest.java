package com.zzf.miku.highlight.command;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UndoManagerTest {

    private final List<String> journal = new ArrayList<>();

    private class Recording extends BaseCommand {
        private final String name;
        private final String type;
        boolean failUndo;

        Recording(String name) {
            this(name, "TEST", null);
        }

        Recording(String name, String type, String groupId) {
            super(name, groupId, null);
            this.name = name;
            this.type = type;
        }

        @Override
        public String getType() {
            return type;
        }

        @Override
        public String getDescription() {
            return "do " + name;
        }

        @Override
        public void execute() {
            journal.add("+" + name);
        }

        @Override
        public void undo() {
            if (failUndo) {
                throw new IllegalStateException("cannot undo " + name);
            }
            journal.add("-" + name);
        }
    }

    @Test
    void executeUndoRedo() {
        UndoManager manager = new UndoManager();
        manager.execute(new Recording("a"));
        manager.execute(new Recording("b"));

        assertEquals("do b", manager.getUndoDescription());
        assertTrue(manager.undo());
        assertEquals("do b", manager.getRedoDescription());
        assertTrue(manager.redo());
        assertEquals(List.of("+a", "+b", "-b", "+b"), journal);

        manager.undo();
        manager.execute(new Recording("c"));
        assertFalse(manager.canRedo());
    }

    @Test
    void emptyStacksReturnFalse() {
        UndoManager manager = new UndoManager();
        assertFalse(manager.undo());
        assertFalse(manager.redo());
        assertNull(manager.getUndoDescription());
    }

    @Test
    void evictsOldestBeyondMaxSize() {
        UndoManager manager = new UndoManager(2);
        manager.execute(new Recording("a"));
        manager.execute(new Recording("b"));
        manager.execute(new Recording("c"));

        assertEquals(2, manager.getUndoStackSize());
        assertEquals(2, manager.undoMultiple(5));
        assertEquals(List.of("+a", "+b", "+c", "-c", "-b"), journal);

        manager.setMaxSize(1);
        assertEquals(0, manager.getUndoStackSize());
        assertThrows(IllegalArgumentException.class, () -> new UndoManager(0));
    }

    @Test
    void failedUndoStaysOnUndoStack() {
        UndoManager manager = new UndoManager();
        Recording broken = new Recording("a");
        broken.failUndo = true;
        manager.execute(broken);

        assertThrows(IllegalStateException.class, manager::undo);

        assertEquals(1, manager.getUndoStackSize());
        assertEquals(0, manager.getRedoStackSize());
        assertFalse(manager.isInProgress());
    }

    @Test
    void rejectsReentrantExecution() {
        UndoManager manager = new UndoManager();
        BaseCommand nested = new Recording("outer") {
            @Override
            public void execute() {
                manager.execute(new Recording("inner"));
            }
        };

        assertThrows(IllegalStateException.class, () -> manager.execute(nested));
        assertEquals(0, manager.getUndoStackSize());
        assertFalse(manager.isInProgress());
    }

    @Test
    void undoUntilTypeStopsBeforeMatch() {
        UndoManager manager = new UndoManager();
        manager.execute(new Recording("a", "MARK", null));
        manager.execute(new Recording("b"));
        manager.execute(new Recording("c"));

        assertEquals(2, manager.undoUntilType("MARK"));
        assertEquals("do a", manager.getUndoDescription());
    }

    @Test
    void undoGroupUnwindsToOldestMember() {
        UndoManager manager = new UndoManager();
        manager.execute(new Recording("a"));
        manager.execute(new Recording("b", "TEST", "g"));
        manager.execute(new Recording("c"));
        manager.execute(new Recording("d", "TEST", "g"));

        assertEquals(3, manager.undoGroup("g"));
        assertEquals("do a", manager.getUndoDescription());
        assertEquals(0, manager.undoGroup("missing"));
    }

    @Test
    void compositeUndoesInReverse() {
        UndoManager manager = new UndoManager();
        manager.execute(new CompositeCommand(List.of(new Recording("a"), new Recording("b"))));
        manager.undo();

        assertEquals(List.of("+a", "+b", "-b", "-a"), journal);
    }

    @Test
    void notifiesListeners() {
        UndoManager manager = new UndoManager();
        List<String> events = new ArrayList<>();
        List<UndoManagerState> states = new ArrayList<>();
        manager.addListener(new UndoListener() {
            @Override
            public void onExecute(Command command) {
                events.add("execute " + command.getId());
            }

            @Override
            public void onUndo(Command command) {
                events.add("undo " + command.getId());
            }

            @Override
            public void onStateChange(UndoManagerState state) {
                states.add(state);
            }
        });

        manager.execute(new Recording("a"));
        manager.undo();

        assertEquals(List.of("execute a", "undo a"), events);
        assertEquals(2, states.size());
        assertTrue(states.get(1).isCanRedo());
        assertFalse(states.get(1).isCanUndo());
    }
}
