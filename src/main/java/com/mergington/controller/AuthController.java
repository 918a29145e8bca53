package com.mergington.controller;

import com.mergington.dto.LoginRequest;
import com.mergington.dto.LoginResponse;
import com.mergington.dto.MessageResponse;
import com.mergington.dto.VerifyResponse;
import com.mergington.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class AuthController {

	private final AuthService authService;

	/**
	 * Authenticate a teacher
	 * POST /auth/login
	 */
	@PostMapping("/login")
	public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
		log.info("Login request received for user: {}", request.getUsername());
		String token = authService.login(request.getUsername(), request.getPassword());
		return ResponseEntity.ok(new LoginResponse(token, request.getUsername(), "Login successful"));
	}

	/**
	 * Invalidate the caller's session, if any
	 * POST /auth/logout
	 */
	@PostMapping("/logout")
	public ResponseEntity<MessageResponse> logout(
			@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
		AuthService.extractToken(authorization).ifPresent(authService::logout);
		return ResponseEntity.ok(new MessageResponse("Logout successful"));
	}

	/**
	 * GET /auth/verify
	 */
	@GetMapping("/verify")
	public ResponseEntity<VerifyResponse> verify(
			@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
		VerifyResponse response = AuthService.extractToken(authorization)
				.flatMap(authService::verify)
				.map(username -> new VerifyResponse(true, username))
				.orElseGet(VerifyResponse::anonymous);
		return ResponseEntity.ok(response);
	}

}
