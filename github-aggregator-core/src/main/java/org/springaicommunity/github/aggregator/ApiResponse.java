package org.springaicommunity.github.aggregator;

import java.util.Map;

/**
 * Status and JSON-serializable body of a consumer-facing call.
 *
 * @param status the HTTP status code
 * @param body the response body
 */
public record ApiResponse(int status, Object body) {

	public static ApiResponse ok(Object body) {
		return new ApiResponse(200, body);
	}

	public static ApiResponse error(int status, String message) {
		return new ApiResponse(status, Map.of("error", message));
	}

	public boolean isSuccess() {
		return status >= 200 && status < 300;
	}

}
