package com.conveyal.catstronauts.datasource;

/**
 * Signals that a remote fetch failed. These propagate unchanged to the resolver that asked for the data, where the
 * query engine turns them into a field-level error.
 */
public class FetchException extends RuntimeException {

    public final FetchErrorType errorType;

    /** The fully resolved URL that was requested. */
    public final String url;

    /** HTTP status reported by the remote resource, only set for {@link FetchErrorType#REMOTE}. */
    public final Integer status;

    private FetchException(FetchErrorType errorType, String url, Integer status, String detail, Throwable cause) {
        super(String.format("%s GET %s: %s", errorType.englishMessage, url, detail), cause);
        this.errorType = errorType;
        this.url = url;
        this.status = status;
    }

    public static FetchException transport(String url, Throwable cause) {
        return new FetchException(FetchErrorType.TRANSPORT, url, null, cause.toString(), cause);
    }

    public static FetchException remote(String url, int status) {
        return new FetchException(FetchErrorType.REMOTE, url, status, "status " + status, null);
    }

    public static FetchException decode(String url, String detail, Throwable cause) {
        return new FetchException(FetchErrorType.DECODE, url, null, detail, cause);
    }
}
