package com.planit.gamification.store;

import com.planit.gamification.exception.GamificationException;

public class DocumentNotFoundException extends GamificationException {

    public DocumentNotFoundException(DocumentPath path) {
        super("DOCUMENT_NOT_FOUND", "No document at " + path);
    }
}
