package com.questrail.hamgateway.message;

/**
 * Thrown when a payload cannot be turned into a typed message.
 *
 * <p>This exception is internal to message processing; routers catch it and
 * report a dropped message instead of propagating it to listeners.</p>
 */
public final class MessageDecodeException extends RuntimeException
{
    private final String tag;

    public MessageDecodeException(String tag, String message)
    {
        super(message);
        this.tag = tag;
    }

    public MessageDecodeException(String tag, String message, Throwable cause)
    {
        super(message, cause);
        this.tag = tag;
    }

    /**
     * The root tag of the payload, or {@code null} if it could not be read.
     */
    public String tag()
    {
        return tag;
    }
}
