package com.zzf.miku.highlight.command;

import java.util.List;

/**
 * Ordered group executed front to back and undone back to front.
 */
public class CompositeCommand extends BaseCommand {
    public static final String TYPE = "COMPOSITE";

    private final List<Command> commands;
    private final String description;

    public CompositeCommand(List<Command> commands) {
        this(commands, null);
    }

    public CompositeCommand(List<Command> commands, String description) {
        super(null);
        this.commands = List.copyOf(commands);
        this.description = description == null ? this.commands.size() + " grouped commands" : description;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public void execute() {
        for (Command command : commands) {
            command.execute();
        }
    }

    @Override
    public void undo() {
        for (int i = commands.size() - 1; i >= 0; i--) {
            commands.get(i).undo();
        }
    }

    public List<Command> getCommands() {
        return commands;
    }
}
