package com.mergington.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

	@ExceptionHandler(ActivityServerException.class)
	public ResponseEntity<ErrorResponse> handleActivityServerException(ActivityServerException ex) {
		log.warn("Request rejected ({}): {}", ex.getStatus().value(), ex.getMessage());
		return ResponseEntity.status(ex.getStatus()).body(new ErrorResponse(ex.getMessage()));
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<Map<String, String>> handleValidationExceptions(
			MethodArgumentNotValidException ex) {
		Map<String, String> errors = new LinkedHashMap<>();
		ex.getBindingResult().getAllErrors().forEach((error) -> {
			String fieldName = ((FieldError) error).getField();
			String errorMessage = error.getDefaultMessage();
			errors.put(fieldName, errorMessage);
		});
		log.warn("Validation error: {}", errors);
		return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
	}

	@ExceptionHandler(MissingServletRequestParameterException.class)
	public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
		log.warn("Missing request parameter: {}", ex.getParameterName());
		ErrorResponse response = new ErrorResponse("Query parameter '" + ex.getParameterName() + "' is required");
		return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
		log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
		return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse("Malformed request body"));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
		// framework errors (unknown static resource, wrong method, ...) keep their own status
		if (ex instanceof org.springframework.web.ErrorResponse frameworkError) {
			log.warn("Request failed ({}): {}", frameworkError.getStatusCode().value(), ex.getMessage());
			return ResponseEntity.status(frameworkError.getStatusCode())
					.body(new ErrorResponse(frameworkError.getBody().getDetail()));
		}
		log.error("Unexpected error", ex);
		ErrorResponse response = new ErrorResponse("Internal server error");
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
	}

	/**
	 * Error body; the web client reads {@code detail}.
	 */
	public static class ErrorResponse {
		private String detail;

		public ErrorResponse() {
		}

		public ErrorResponse(String detail) {
			this.detail = detail;
		}

		public String getDetail() {
			return detail;
		}

		public void setDetail(String detail) {
			this.detail = detail;
		}
	}

}
