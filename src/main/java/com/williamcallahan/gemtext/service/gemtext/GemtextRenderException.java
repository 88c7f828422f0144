package com.williamcallahan.gemtext.service.gemtext;

/**
 * Signals an unrecoverable failure while rendering an HTML tree as gemtext.
 *
 * <p>A render that throws this exception produces no usable text.</p>
 */
public class GemtextRenderException extends IllegalStateException {

    /**
     * Creates a render exception describing a broken rendering invariant.
     *
     * @param message failure summary
     */
    public GemtextRenderException(String message) {
        super(message);
    }

    /**
     * Creates a render exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public GemtextRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
