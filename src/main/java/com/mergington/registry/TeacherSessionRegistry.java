package com.mergington.registry;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live teacher sessions, token to username. Sessions never expire; they end only on logout.
 */
@Component
public class TeacherSessionRegistry {

	private final Map<String, String> sessionTeachers = new ConcurrentHashMap<>();

	/**
	 * @return false if the token is already bound, in which case nothing is stored
	 */
	public boolean register(String token, String username) {
		return sessionTeachers.putIfAbsent(token, username) == null;
	}

	public boolean removeByToken(String token) {
		return sessionTeachers.remove(token) != null;
	}

	public Optional<String> getUsername(String token) {
		return Optional.ofNullable(sessionTeachers.get(token));
	}

	public int getActiveSessionCount() {
		return sessionTeachers.size();
	}
}
