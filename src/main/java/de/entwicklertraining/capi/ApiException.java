package de.entwicklertraining.capi;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the API answers with a status of 400 or above.
 * <p>
 * The body is parsed as a Cloud Controller error document. Bodies that are not JSON
 * end up as one synthetic {@link ApiError} carrying the raw text.
 */
public class ApiException extends ApiClientException {

    public static final int CODE_NOT_AUTHENTICATED = 10002;
    public static final int CODE_NOT_AUTHORIZED = 10003;
    public static final int CODE_NOT_FOUND = 10010;

    private final int statusCode;
    private final List<ApiError> errors;

    public ApiException(int statusCode, List<ApiError> errors) {
        super(ErrorKind.API, buildMessage(statusCode, errors));
        this.statusCode = statusCode;
        this.errors = List.copyOf(errors);
    }

    /**
     * Builds an exception from a raw error response.
     *
     * @param statusCode the HTTP status
     * @param body       the response body, may be {@code null}
     */
    public static ApiException parse(int statusCode, String body) {
        List<ApiError> errors = new ArrayList<>();
        if (body != null && !body.isBlank()) {
            try {
                JSONObject json = new JSONObject(body);
                JSONArray array = json.optJSONArray("errors");
                if (array != null) {
                    for (int i = 0; i < array.length(); i++) {
                        JSONObject entry = array.optJSONObject(i);
                        if (entry != null) {
                            errors.add(ApiError.fromJson(entry));
                        }
                    }
                }
            } catch (JSONException e) {
                errors.add(new ApiError(0, "UnknownError", body.trim()));
            }
        }
        if (errors.isEmpty()) {
            errors.add(new ApiError(0, "UnknownError", "HTTP " + statusCode));
        }
        return new ApiException(statusCode, errors);
    }

    private static String buildMessage(int statusCode, List<ApiError> errors) {
        if (errors.isEmpty()) {
            return "API error (HTTP " + statusCode + ")";
        }
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        return errors.stream().map(ApiError::toString).collect(Collectors.joining("; ", "multiple errors: ", ""));
    }

    public int getStatusCode() {
        return statusCode;
    }

    public List<ApiError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrorCode(int code) {
        return errors.stream().anyMatch(e -> e.code() == code);
    }

    public boolean isNotFound() {
        return statusCode == 404 || hasErrorCode(CODE_NOT_FOUND);
    }

    public boolean isUnauthorized() {
        return statusCode == 401 || hasErrorCode(CODE_NOT_AUTHENTICATED);
    }

    public boolean isForbidden() {
        return statusCode == 403 || hasErrorCode(CODE_NOT_AUTHORIZED);
    }
}
