package com.delinea.tss.auth;

import java.util.Map;

/**
 * Exception thrown when a call to Secret Server, Secret Server Cloud or the Platform fails.
 *
 * <p>Captures the HTTP status code, the {@link AuthStage} that failed and the error text
 * returned by the backend. Status code 0 indicates that no response was received.
 */
public class TssException extends Exception {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final int httpStatusCode;
    private final AuthStage stage;

    /**
     * Creates a new TssException.
     *
     * @param message        the error message
     * @param httpStatusCode the HTTP status code (0 when no response was received)
     * @param stage          the stage that failed
     */
    public TssException(String message, int httpStatusCode, AuthStage stage) {
        super(message);
        this.httpStatusCode = httpStatusCode;
        this.stage = stage;
    }

    /**
     * Creates a new TssException with a cause.
     *
     * @param message        the error message
     * @param httpStatusCode the HTTP status code
     * @param stage          the stage that failed
     * @param cause          the underlying cause
     */
    public TssException(String message, int httpStatusCode, AuthStage stage, Throwable cause) {
        super(message, cause);
        this.httpStatusCode = httpStatusCode;
        this.stage = stage;
    }

    /**
     * Gets the HTTP status code of the failed response.
     *
     * @return the status code, or 0 if the request failed before receiving a response
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    public AuthStage getStage() {
        return stage;
    }

    /**
     * Whether the backend rejected the presented credential (401 or 403).
     */
    public boolean isAuthorizationFailure() {
        return httpStatusCode == 401 || httpStatusCode == 403;
    }

    /**
     * Creates a TssException from an HTTP error response.
     *
     * @param statusCode the HTTP status code
     * @param body       the response body (may contain JSON error details)
     * @param stage      the stage that issued the request
     * @return a new TssException with parsed error message
     */
    public static TssException fromResponse(int statusCode, String body, AuthStage stage) {
        return new TssException(describeError(statusCode, body), statusCode, stage);
    }

    /**
     * Builds a readable message from an error body.
     *
     * <p>Understands OAuth errors ({@code error}, {@code error_description}) and Secret Server
     * REST errors ({@code message}, {@code errorCode}). Anything else is echoed, truncated.
     */
    static String describeError(int statusCode, String body) {
        if (Preconditions.isBlank(body)) {
            return "Secret Server returned status " + statusCode;
        }

        Map<String, Object> root = JsonUtil.parseObject(body);
        if (root != null) {
            String error = JsonUtil.getString(root, "error");
            String description = JsonUtil.getString(root, "error_description");
            if (!Preconditions.isBlank(error)) {
                return Preconditions.isBlank(description) ? error : error + ": " + description;
            }
            String message = JsonUtil.getString(root, "message");
            if (!Preconditions.isBlank(message)) {
                String code = JsonUtil.getString(root, "errorCode");
                return Preconditions.isBlank(code) ? message : message + " (" + code + ")";
            }
        }

        String truncated = body.length() > MAX_BODY_IN_MESSAGE
                ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..."
                : body;
        return "Secret Server returned status " + statusCode + ": " + truncated;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "message='" + getMessage() + '\'' +
                ", httpStatusCode=" + httpStatusCode +
                ", stage=" + stage +
                '}';
    }
}
