package com.roomrelay.model;

/**
 * Outbound side of one client's transport, as seen by the relay core.
 * Implementations must tolerate {@link #close()} being called more than once.
 */
public interface ClientConnection {

    /**
     * Stable identifier of the underlying connection
     */
    String getId();

    /**
     * Write one text frame.
     * @return false if the frame could not be written; the caller treats this as a disconnect
     */
    boolean send(String frame);

    /**
     * Close the underlying connection
     */
    void close();

    boolean isOpen();
}
