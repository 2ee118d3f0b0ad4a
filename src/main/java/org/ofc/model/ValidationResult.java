package org.ofc.model;

/**
 * Outcome of an advisory check. Rule violations are reported here rather than thrown.
 *
 * @param valid          whether the checked action or state is legal
 * @param errorMessage   reason when not valid
 * @param warningMessage non-blocking remark, possibly present on a valid result
 */
public record ValidationResult(boolean valid, String errorMessage, String warningMessage) {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public static ValidationResult ok() { return OK; }

    public static ValidationResult error(String message) { return new ValidationResult(false, message, null); }

    public static ValidationResult warning(String message) { return new ValidationResult(true, null, message); }

    public boolean hasWarning() { return warningMessage != null; }
}
