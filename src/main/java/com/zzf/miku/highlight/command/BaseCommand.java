package com.zzf.miku.highlight.command;

import java.util.List;

public abstract class BaseCommand implements Command {
    private final long createdAt;
    private final String id;
    private final String groupId;
    private final List<String> tags;

    protected BaseCommand(String id) {
        this(id, null, null);
    }

    protected BaseCommand(String id, String groupId, List<String> tags) {
        this.createdAt = System.currentTimeMillis();
        this.id = id;
        this.groupId = groupId;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getGroupId() {
        return groupId;
    }

    @Override
    public List<String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return getType() + "{id=" + id + ", description=" + getDescription() + "}";
    }

    protected static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
