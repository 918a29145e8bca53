package com.mergington.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergington.config.ActivityServerProperties;
import com.mergington.model.Activity;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Reads the startup roster. Each call returns a fresh, mutable map in file order.
 */
@Repository
@RequiredArgsConstructor
public class ActivitySeedRepository {

	private static final TypeReference<LinkedHashMap<String, Activity>> ACTIVITY_MAP =
			new TypeReference<>() {
			};

	private final ResourceLoader resourceLoader;
	private final ObjectMapper objectMapper;
	private final ActivityServerProperties properties;

	public LinkedHashMap<String, Activity> loadSeed() {
		Resource resource = resourceLoader.getResource(properties.activitiesResource());
		LinkedHashMap<String, Activity> activities;
		try (InputStream in = resource.getInputStream()) {
			activities = objectMapper.readValue(in, ACTIVITY_MAP);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read activities from " + resource.getDescription(), e);
		}
		if (activities == null) {
			throw new IllegalStateException("No activities in " + resource.getDescription());
		}
		for (Map.Entry<String, Activity> entry : activities.entrySet()) {
			Activity activity = entry.getValue();
			if (activity.getParticipants() == null) {
				activity.setParticipants(new ArrayList<>());
			}
			// a seeded roster must already hold each email once
			if (new LinkedHashSet<>(activity.getParticipants()).size() != activity.getParticipants().size()) {
				throw new IllegalStateException("Duplicate participant in seed roster of " + entry.getKey());
			}
		}
		return activities;
	}

}
