package com.subagent.gateway.grouping;

/**
 * Raised by the grouping orchestrator.
 *
 * Input errors ({@link Kind#EMPTY_INPUT}, {@link Kind#INVALID_CONSTRAINTS})
 * are thrown before any completion call. The remaining kinds describe a
 * failed attempt; only {@link Kind#EXHAUSTED} and {@link Kind#INTERRUPTED}
 * ever leave {@code groupTools}.
 */
public class GroupingException extends RuntimeException {

    public enum Kind {
        EMPTY_INPUT,
        INVALID_CONSTRAINTS,
        COMPLETION_FAILED,
        REPLY_REJECTED,
        EXHAUSTED,
        INTERRUPTED
    }

    private final Kind   kind;
    private final String detail;

    public GroupingException(Kind kind, String detail) {
        super("[" + kind + "] " + detail);
        this.kind   = kind;
        this.detail = detail;
    }

    public GroupingException(Kind kind, String detail, Throwable cause) {
        super("[" + kind + "] " + detail, cause);
        this.kind   = kind;
        this.detail = detail;
    }

    public Kind getKind() { return kind; }

    /** The message without the kind prefix; this is what gets fed back to the LLM. */
    public String getDetail() { return detail; }
}
