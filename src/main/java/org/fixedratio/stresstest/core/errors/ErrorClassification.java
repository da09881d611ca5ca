package org.fixedratio.stresstest.core.errors;

/**
 * Result of classifying a raw failure message.
 *
 * @param kind        The recovery kind.
 * @param code        The parsed contract error code, or {@code null} if none was found.
 * @param recoverable Whether the kind can ever be recovered by retrying.
 */
public record ErrorClassification(ErrorKind kind, Integer code, boolean recoverable) {

    public static ErrorClassification of(ErrorKind kind, Integer code) {
        return new ErrorClassification(kind, code, kind.category() != ErrorCategory.FATAL_CONFIGURATION);
    }

    public String describe() {
        return code == null ? kind.name() : kind.name() + " (" + code + ": " + ContractError.messageFor(code) + ")";
    }
}
