package com.conveyal.catstronauts.datasource;

/**
 * The ways a single remote fetch can fail. Kept distinct so that a contract drift in the remote resource (DECODE)
 * can be told apart from the resource being down (TRANSPORT) or refusing the request (REMOTE).
 */
public enum FetchErrorType {
    TRANSPORT("The remote call could not be completed."),
    REMOTE("The remote resource responded with a non-success status."),
    DECODE("The remote response body could not be read as the expected shape.");

    public final String englishMessage;

    FetchErrorType(String englishMessage) {
        this.englishMessage = englishMessage;
    }
}
