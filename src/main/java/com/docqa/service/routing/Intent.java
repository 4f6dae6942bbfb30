package com.docqa.service.routing;

public enum Intent {
    RAG_QUERY,
    SUMMARIZE,
    TRANSLATE,
    CHECKLIST;

    public boolean isUtility() {
        return this != RAG_QUERY;
    }
}
