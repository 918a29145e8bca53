package com.mergington.service;

import com.mergington.exception.ActivityNotFoundException;
import com.mergington.exception.RosterConflictException;
import com.mergington.model.Activity;
import com.mergington.repository.ActivitySeedRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the activity rosters. The activity set is fixed at startup; only participant
 * lists change, and every check-then-change runs under the write lock.
 */
@Service
@Slf4j
public class ActivityService {

	private final AuthService authService;
	private final Map<String, Activity> activities;
	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	public ActivityService(AuthService authService, ActivitySeedRepository seedRepository) {
		this.authService = authService;
		this.activities = seedRepository.loadSeed();
		log.info("Seeded {} activities", activities.size());
	}

	/**
	 * Snapshot of every activity in seed order. Later roster changes do not show through.
	 */
	public Map<String, Activity> listActivities() {
		lock.readLock().lock();
		try {
			Map<String, Activity> snapshot = new LinkedHashMap<>();
			activities.forEach((name, activity) -> snapshot.put(name, activity.copy()));
			return snapshot;
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Append a student to a roster. Capacity is not checked.
	 */
	public void signup(String activityName, String email, String token) {
		String teacher = authService.requireTeacher(token, "register");

		lock.writeLock().lock();
		try {
			Activity activity = getExisting(activityName);
			if (activity.getParticipants().contains(email)) {
				throw RosterConflictException.alreadySignedUp();
			}
			activity.getParticipants().add(email);
		} finally {
			lock.writeLock().unlock();
		}
		log.info("{} signed up {} for {}", teacher, email, activityName);
	}

	/**
	 * Remove a student from a roster, keeping the order of the remaining entries.
	 */
	public void unregister(String activityName, String email, String token) {
		String teacher = authService.requireTeacher(token, "unregister");

		lock.writeLock().lock();
		try {
			Activity activity = getExisting(activityName);
			if (!activity.getParticipants().remove(email)) {
				throw RosterConflictException.notSignedUp();
			}
		} finally {
			lock.writeLock().unlock();
		}
		log.info("{} unregistered {} from {}", teacher, email, activityName);
	}

	private Activity getExisting(String activityName) {
		Activity activity = activities.get(activityName);
		if (activity == null) {
			log.warn("No activity named '{}'", activityName);
			throw new ActivityNotFoundException();
		}
		return activity;
	}

}
