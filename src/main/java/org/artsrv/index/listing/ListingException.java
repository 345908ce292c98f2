package org.artsrv.index.listing;

/**
 * Enumeration of a prefix failed. The whole listing is aborted; nothing partial is emitted.
 */
public class ListingException extends RuntimeException {
    public ListingException(String message, Throwable cause) { super(message, cause); }
    public ListingException(String message) { super(message); }
}
