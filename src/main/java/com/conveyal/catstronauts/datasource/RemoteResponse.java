package com.conveyal.catstronauts.datasource;

/**
 * Status and body of one completed HTTP exchange.
 */
public class RemoteResponse {

    public final int status;
    public final String body;

    public RemoteResponse(int status, String body) {
        this.status = status;
        this.body = body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
