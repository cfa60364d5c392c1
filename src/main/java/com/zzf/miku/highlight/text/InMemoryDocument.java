package com.zzf.miku.highlight.text;

public class InMemoryDocument implements DocumentAccessor {
    private volatile String content;

    public InMemoryDocument(String content) {
        this.content = content == null ? "" : content;
    }

    @Override
    public String getDocument() {
        return content;
    }

    @Override
    public void updateDocument(String content) {
        this.content = content == null ? "" : content;
    }
}
