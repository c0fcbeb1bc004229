package com.filenvault.error;

/** The API envelope came back with {@code status=false}. */
public class FilenApiException extends FilenException {

    private final String endpoint;
    private final String code;

    public FilenApiException(String endpoint, String message, String code) {
        super(endpoint + ": " + message + (code == null || code.isEmpty() ? "" : " (" + code + ")"));
        this.endpoint = endpoint;
        this.code = code;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getCode() {
        return code;
    }
}
