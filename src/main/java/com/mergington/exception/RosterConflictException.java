package com.mergington.exception;

import org.springframework.http.HttpStatus;

/**
 * Signup of a student already on the roster, or removal of one who is not.
 */
public class RosterConflictException extends ActivityServerException {

	private RosterConflictException(String message) {
		super(HttpStatus.BAD_REQUEST, message);
	}

	public static RosterConflictException alreadySignedUp() {
		return new RosterConflictException("Student is already signed up");
	}

	public static RosterConflictException notSignedUp() {
		return new RosterConflictException("Student is not signed up for this activity");
	}

}
