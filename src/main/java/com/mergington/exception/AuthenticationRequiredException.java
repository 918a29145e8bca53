package com.mergington.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing or unknown bearer token on a roster change.
 */
public class AuthenticationRequiredException extends ActivityServerException {

	public AuthenticationRequiredException(String action) {
		super(HttpStatus.FORBIDDEN, "Authentication required. Only teachers can " + action + " students.");
	}

}
