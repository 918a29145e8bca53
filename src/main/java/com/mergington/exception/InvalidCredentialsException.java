package com.mergington.exception;

import org.springframework.http.HttpStatus;

public class InvalidCredentialsException extends ActivityServerException {

	public InvalidCredentialsException() {
		super(HttpStatus.UNAUTHORIZED, "Invalid credentials");
	}

}
