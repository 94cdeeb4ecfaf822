package de.entwicklertraining.capi;

import org.json.JSONObject;

/**
 * A single entry of a Cloud Controller error body ({@code {"errors":[{code,title,detail}]}}).
 *
 * @param code   numeric Cloud Controller error code (e.g. 10010)
 * @param title  error title such as {@code CF-ResourceNotFound}
 * @param detail human readable detail
 */
public record ApiError(int code, String title, String detail) {

    public static ApiError fromJson(JSONObject json) {
        return new ApiError(
                json.optInt("code", 0),
                json.optString("title", ""),
                json.optString("detail", ""));
    }

    @Override
    public String toString() {
        return title + ": " + detail + " (code: " + code + ")";
    }
}
