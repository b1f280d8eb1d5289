package com.psl.search.service;

/**
 * Caller input that cannot be served. The only failure that reaches API clients as a 4xx.
 */
public class InvalidSearchRequestException extends RuntimeException {
    private final String code;

    public InvalidSearchRequestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
