package com.ttennebkram.ftmixer.model;

/**
 * Raised when a mixer precondition is violated.
 * The {@link Kind} lets callers (and the JSON layer) tell the cases apart
 * without parsing messages.
 */
public class MixerException extends RuntimeException {

    public enum Kind {
        NOT_LOADED,
        SPECTRUM_NOT_COMPUTED,
        INVALID_WEIGHT,
        INVALID_REGION,
        SHAPE_MISMATCH,
        NO_ACTIVE_SLOTS,
        INVALID_MODE,
        INVALID_SLOT,
        INVALID_PORT,
        INVALID_COMPONENT,
        INVALID_REQUEST,
        IO_ERROR
    }

    private final Kind kind;

    public MixerException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MixerException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
