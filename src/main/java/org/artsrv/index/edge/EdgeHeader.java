package org.artsrv.index.edge;

/** CloudFront header value: the header name as sent plus its value. */
public record EdgeHeader(String key, String value) {}
