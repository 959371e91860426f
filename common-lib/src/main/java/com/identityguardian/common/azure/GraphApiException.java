package com.identityguardian.common.azure;

import com.identityguardian.common.directory.DirectoryException;

/** Non-2xx answer from a Microsoft cloud API. */
public class GraphApiException extends DirectoryException {
    private final int statusCode;
    private final String responseBody;

    public GraphApiException(int statusCode, String responseBody) {
        super("Graph API returned " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isConflict() {
        return statusCode == 409 || responseBody.contains("ObjectConflict");
    }
}
