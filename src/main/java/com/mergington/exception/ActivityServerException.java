package com.mergington.exception;

import org.springframework.http.HttpStatus;

/**
 * Base for failures reported straight back to the caller with a fixed status.
 */
public abstract class ActivityServerException extends RuntimeException {

	private final HttpStatus status;

	protected ActivityServerException(HttpStatus status, String message) {
		super(message);
		this.status = status;
	}

	public HttpStatus getStatus() {
		return status;
	}

}
