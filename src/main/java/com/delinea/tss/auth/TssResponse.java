package com.delinea.tss.auth;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * A response received from a Secret Server or Platform endpoint.
 *
 * <p>Unlike an exception, a TssResponse may carry any status code; callers decide what a
 * non-2xx status means for their stage. The body is parsed as JSON on first access.
 */
public class TssResponse {

    private final int status;
    private final String body;
    private final HttpHeaders headers;
    private Map<String, Object> json;
    private boolean parsed;

    public TssResponse(int status, String body, HttpHeaders headers) {
        this.status = status;
        this.body = body;
        this.headers = headers;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * All values of a response header, matched case-insensitively.
     */
    public List<String> getHeaders(String name) {
        return headers != null ? headers.allValues(name) : List.of();
    }

    /**
     * The body parsed as a JSON object.
     *
     * @return the object, or null if the body is empty or not a JSON object
     */
    public Map<String, Object> getJson() {
        if (!parsed) {
            json = JsonUtil.parseObject(body);
            parsed = true;
        }
        return json;
    }

    public String getString(String field) {
        return JsonUtil.getString(getJson(), field);
    }

    public long getLong(String field, long defaultValue) {
        return JsonUtil.getLong(getJson(), field, defaultValue);
    }
}
