package com.callplatform.guardsvc.domain.guard;

import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.shared.http.RequestHeaders;

/**
 * One inbound request as seen by the guard pipeline.
 */
public record GuardRequest(String method, String path, UserContext context, RequestHeaders headers) {

    public GuardRequest {
        method = method == null ? "GET" : method;
        path = path == null || path.isBlank() ? "/" : path;
        headers = headers == null ? RequestHeaders.empty() : headers;
    }
}
