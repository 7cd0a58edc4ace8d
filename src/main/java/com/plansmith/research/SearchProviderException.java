package com.plansmith.research;

/**
 * Thrown when the search provider is unreachable, misconfigured, or rejects a request.
 */
public class SearchProviderException extends RuntimeException {

    public SearchProviderException(String message) {
        super(message);
    }

    public SearchProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
