package com.zzf.miku.highlight.text;

/**
 * The live document, owned outside the engine. Callers re-read it right before every use.
 */
public interface DocumentAccessor {

    String getDocument();

    void updateDocument(String content);
}
