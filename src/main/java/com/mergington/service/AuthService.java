package com.mergington.service;

import com.mergington.config.ActivityServerProperties;
import com.mergington.exception.AuthenticationRequiredException;
import com.mergington.exception.InvalidCredentialsException;
import com.mergington.model.Teacher;
import com.mergington.registry.TeacherSessionRegistry;
import com.mergington.repository.TeacherRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

	private static final String BEARER_PREFIX = "Bearer ";
	private static final int MAX_TOKEN_ATTEMPTS = 100;

	private final TeacherRepository teacherRepository;
	private final TeacherSessionRegistry sessionRegistry;
	private final ActivityServerProperties properties;
	private final SecureRandom random = new SecureRandom();

	/**
	 * Check teacher credentials and open a session.
	 *
	 * @return the new bearer token
	 * @throws InvalidCredentialsException if no teacher matches; no session is created
	 */
	public String login(String username, String password) {
		Optional<Teacher> teacher = teacherRepository.findByUsername(username)
				.filter(t -> t.getPassword().equals(password));
		if (teacher.isEmpty()) {
			log.warn("Login failed for user: {}", username);
			throw new InvalidCredentialsException();
		}

		String token = newSessionToken(username);
		log.info("Teacher {} logged in ({} active sessions)", username, sessionRegistry.getActiveSessionCount());
		return token;
	}

	/**
	 * Close the session for a token. Unknown or missing tokens are ignored.
	 */
	public void logout(String token) {
		if (token == null) {
			return;
		}
		Optional<String> username = sessionRegistry.getUsername(token);
		if (sessionRegistry.removeByToken(token)) {
			log.info("Teacher {} logged out", username.orElse("?"));
		} else {
			log.debug("Logout for unknown session token ignored");
		}
	}

	/**
	 * @return the teacher owning the token, or empty if the token is missing or unknown
	 */
	public Optional<String> verify(String token) {
		if (token == null) {
			return Optional.empty();
		}
		return sessionRegistry.getUsername(token);
	}

	/**
	 * Like {@link #verify(String)} but fails for anonymous callers.
	 *
	 * @param action verb used in the rejection message, e.g. "register"
	 * @throws AuthenticationRequiredException if the token is missing or unknown
	 */
	public String requireTeacher(String token, String action) {
		return verify(token).orElseThrow(() -> new AuthenticationRequiredException(action));
	}

	/**
	 * Pull the token out of an Authorization header value. A value without the
	 * {@code Bearer } prefix is taken as the token itself.
	 */
	public static Optional<String> extractToken(String authorizationHeader) {
		if (authorizationHeader == null || authorizationHeader.isBlank()) {
			return Optional.empty();
		}
		String token = authorizationHeader.startsWith(BEARER_PREFIX)
				? authorizationHeader.substring(BEARER_PREFIX.length())
				: authorizationHeader;
		return token.isBlank() ? Optional.empty() : Optional.of(token.trim());
	}

	private String newSessionToken(String username) {
		byte[] bytes = new byte[properties.tokenBytes()];
		for (int attempt = 0; attempt < MAX_TOKEN_ATTEMPTS; attempt++) {
			random.nextBytes(bytes);
			String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
			if (sessionRegistry.register(token, username)) {
				return token;
			}
			log.debug("Session token collision, retrying");
		}
		throw new IllegalStateException("Failed to generate unique session token after " + MAX_TOKEN_ATTEMPTS + " attempts");
	}

}
