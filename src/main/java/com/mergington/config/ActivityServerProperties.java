package com.mergington.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Startup resources and session settings.
 *
 * <pre>{@code
 * mergington:
 *   teachers-resource: classpath:teachers.json
 *   activities-resource: classpath:activities.json
 *   token-bytes: 32
 * }</pre>
 */
@ConfigurationProperties(prefix = "mergington")
public record ActivityServerProperties(
		@DefaultValue("classpath:teachers.json") String teachersResource,
		@DefaultValue("classpath:activities.json") String activitiesResource,
		@DefaultValue("32") int tokenBytes) {

	public ActivityServerProperties {
		if (tokenBytes <= 0) {
			throw new IllegalArgumentException("mergington.token-bytes must be positive, got: " + tokenBytes);
		}
	}
}
