package com.mergington.exception;

import org.springframework.http.HttpStatus;

public class ActivityNotFoundException extends ActivityServerException {

	public ActivityNotFoundException() {
		super(HttpStatus.NOT_FOUND, "Activity not found");
	}

}
