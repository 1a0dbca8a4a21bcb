package com.starscape.mediavault.features.rendering.domain;

/**
 * A thumbnail or preview could not be produced.
 */
public class RenderException extends Exception {
    
    public enum Reason {
        /** The source file does not exist. */
        SOURCE_MISSING,
        /** The source exists but could not be decoded (corrupt, truncated or unsupported). */
        DECODE_FAILED,
        /** An external tool such as ffmpeg is not installed. */
        TOOL_UNAVAILABLE,
        /** An external tool ran but did not produce output. */
        TOOL_FAILED,
        /** The output image could not be encoded. */
        ENCODE_FAILED
    }
    
    private final Reason reason;
    
    public RenderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
    
    public RenderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
    
    public Reason getReason() {
        return reason;
    }
}
