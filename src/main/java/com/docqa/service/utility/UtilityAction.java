package com.docqa.service.utility;

import com.docqa.exception.InvalidArgumentException;
import com.docqa.service.routing.Intent;

import java.util.Locale;

public enum UtilityAction {
    SUMMARIZE,
    TRANSLATE,
    CHECKLIST;

    /**
     * Case-insensitive lookup of an action name such as "summarize".
     */
    public static UtilityAction parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("Utility action is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Unknown utility action: " + name);
        }
    }

    public static UtilityAction fromIntent(Intent intent) {
        if (intent == null || !intent.isUtility()) {
            throw new InvalidArgumentException(intent + " is not a utility action");
        }
        return valueOf(intent.name());
    }

    public Intent toIntent() {
        return Intent.valueOf(name());
    }

    public String functionName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
