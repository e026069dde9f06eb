package com.chatmirror.web;

public class UnexpectedStatusCodeException extends RuntimeException {
    private final int statusCode;

    public UnexpectedStatusCodeException(int statusCode, String uri) {
        super("Unexpected status code: " + statusCode + " from " + uri);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
