package com.docqa.exception;

public class DocumentNotFoundException extends RagException {

    public DocumentNotFoundException(String documentId) {
        super("Document not found or not ready: " + documentId);
    }
}
