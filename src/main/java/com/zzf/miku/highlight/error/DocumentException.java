package com.zzf.miku.highlight.error;

/**
 * The live document no longer contains text a command needs to act on.
 */
public class DocumentException extends HighlightException {

    public DocumentException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "DOCUMENT_ERROR";
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
