package com.docqa.service.utility;

/**
 * Outcome of one utility run. {@code error} is null on success.
 */
public record UtilityResult(UtilityAction action, String outputText, String error) {

    public static UtilityResult success(UtilityAction action, String outputText) {
        return new UtilityResult(action, outputText, null);
    }

    public static UtilityResult failure(UtilityAction action, String error) {
        return new UtilityResult(action, null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
