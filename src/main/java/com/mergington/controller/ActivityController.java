package com.mergington.controller;

import com.mergington.dto.MessageResponse;
import com.mergington.model.Activity;
import com.mergington.service.ActivityService;
import com.mergington.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/activities")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class ActivityController {

	private final ActivityService activityService;

	/**
	 * All activities keyed by name
	 * GET /activities
	 */
	@GetMapping
	public ResponseEntity<Map<String, Activity>> list() {
		return ResponseEntity.ok(activityService.listActivities());
	}

	/**
	 * Sign a student up (teachers only)
	 * POST /activities/{activityName}/signup?email=xxx
	 */
	@PostMapping("/{activityName}/signup")
	public ResponseEntity<MessageResponse> signup(
			@PathVariable String activityName,
			@RequestParam String email,
			@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
		log.debug("Signup request for {} in {}", email, activityName);
		String token = AuthService.extractToken(authorization).orElse(null);
		activityService.signup(activityName, email, token);
		return ResponseEntity.ok(new MessageResponse("Signed up " + email + " for " + activityName));
	}

	/**
	 * Remove a student (teachers only)
	 * DELETE /activities/{activityName}/unregister?email=xxx
	 */
	@DeleteMapping("/{activityName}/unregister")
	public ResponseEntity<MessageResponse> unregister(
			@PathVariable String activityName,
			@RequestParam String email,
			@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
		log.debug("Unregister request for {} in {}", email, activityName);
		String token = AuthService.extractToken(authorization).orElse(null);
		activityService.unregister(activityName, email, token);
		return ResponseEntity.ok(new MessageResponse("Unregistered " + email + " from " + activityName));
	}

}
