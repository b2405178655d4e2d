package com.forumbot.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forumbot.channel.forum.ForumPlatformException;

import java.io.IOException;

/**
 * Discord REST API constants, error type and error-body parsing.
 */
public final class DiscordApi {

    private DiscordApi() {
    }

    public static final String API_BASE = "https://discord.com/api/v10";
    public static final String AUDIT_LOG_REASON_HEADER = "X-Audit-Log-Reason";

    /** Discord JSON error codes used for classification. */
    public static final int CODE_UNKNOWN_CHANNEL = 10003;
    public static final int CODE_MISSING_ACCESS = 50001;
    public static final int CODE_MISSING_PERMISSIONS = 50013;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // =========================================================================
    // Error type
    // =========================================================================

    /**
     * A Discord call failed. A rate-limit hint, when Discord sends one, is part
     * of the message.
     */
    public static class ApiError extends ForumPlatformException {

        public ApiError(Failure failure, int status, String message) {
            super(failure, status, message);
        }

        public ApiError(Failure failure, int status, String message, Throwable cause) {
            super(failure, status, message, cause);
        }
    }

    /**
     * Build an {@link ApiError} from a non-2xx response.
     */
    public static ApiError errorFromResponse(int status, String responseBody) {
        ErrorBody body = parseErrorBody(responseBody);
        String text = formatErrorText(body, responseBody);
        String message = "HTTP " + status + (text != null ? ": " + text : "");
        return new ApiError(classify(status, body.code()), status, message);
    }

    /**
     * Map an HTTP status (and Discord error code when present) to a failure
     * kind.
     */
    public static ForumPlatformException.Failure classify(int status, Integer code) {
        if (code != null) {
            if (code == CODE_UNKNOWN_CHANNEL)
                return ForumPlatformException.Failure.NOT_FOUND;
            if (code == CODE_MISSING_ACCESS || code == CODE_MISSING_PERMISSIONS)
                return ForumPlatformException.Failure.PERMISSION;
        }
        if (status == 404)
            return ForumPlatformException.Failure.NOT_FOUND;
        if (status == 401 || status == 403)
            return ForumPlatformException.Failure.PERMISSION;
        if (status == 429 || status >= 500)
            return ForumPlatformException.Failure.TRANSPORT;
        return ForumPlatformException.Failure.UNKNOWN;
    }

    // =========================================================================
    // Error text parsing
    // =========================================================================

    record ErrorBody(String message, Integer code, Double retryAfterSeconds) {
    }

    static ErrorBody parseErrorBody(String responseBody) {
        if (responseBody == null || responseBody.isBlank())
            return new ErrorBody(null, null, null);
        try {
            JsonNode root = MAPPER.readTree(responseBody);
            if (root == null || !root.isObject())
                return new ErrorBody(null, null, null);
            String message = root.path("message").isTextual() ? root.path("message").asText() : null;
            Integer code = root.path("code").isNumber() ? root.path("code").asInt() : null;
            Double retryAfter = root.path("retry_after").isNumber() ? root.path("retry_after").asDouble() : null;
            return new ErrorBody(message, code, retryAfter);
        } catch (IOException e) {
            return new ErrorBody(null, null, null);
        }
    }

    /**
     * Human-readable error text: the JSON {@code message} with an optional
     * retry hint, or the trimmed raw body when it is not JSON.
     */
    public static String formatErrorText(String responseBody) {
        return formatErrorText(parseErrorBody(responseBody), responseBody);
    }

    private static String formatErrorText(ErrorBody body, String responseBody) {
        if (responseBody == null || responseBody.isBlank())
            return null;
        String trimmed = responseBody.trim();
        if (!trimmed.startsWith("{"))
            return trimmed;
        String msg = body.message() != null && !body.message().isEmpty() ? body.message() : "unknown error";
        if (body.retryAfterSeconds() != null) {
            double seconds = body.retryAfterSeconds();
            String formatted = seconds < 10 ? String.format("%.1fs", seconds) : Math.round(seconds) + "s";
            return msg + " (retry after " + formatted + ")";
        }
        return msg;
    }
}
