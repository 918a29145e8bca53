package com.mergington.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One extracurricular offering. {@code maxParticipants} is stored and reported
 * but signup does not enforce it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Activity {

	private String description;

	private String schedule;

	@JsonProperty("max_participants")
	private int maxParticipants;

	@Builder.Default
	private List<String> participants = new ArrayList<>();

	/**
	 * Copy with its own participant list.
	 */
	public Activity copy() {
		return toBuilder().participants(new ArrayList<>(participants)).build();
	}

}
