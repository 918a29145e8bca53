package com.mergington.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergington.config.ActivityServerProperties;
import com.mergington.model.Teacher;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only teacher credentials, loaded once from the configured JSON resource.
 */
@Repository
@Slf4j
public class TeacherRepository {

	private final List<Teacher> teachers;

	public TeacherRepository(ResourceLoader resourceLoader, ObjectMapper objectMapper,
			ActivityServerProperties properties) {
		this.teachers = List.copyOf(load(resourceLoader.getResource(properties.teachersResource()), objectMapper));
		log.info("Loaded {} teacher accounts from {}", teachers.size(), properties.teachersResource());
	}

	public Optional<Teacher> findByUsername(String username) {
		return teachers.stream()
				.filter(teacher -> teacher.getUsername().equals(username))
				.findFirst();
	}

	public int count() {
		return teachers.size();
	}

	private static List<Teacher> load(Resource resource, ObjectMapper objectMapper) {
		try (InputStream in = resource.getInputStream()) {
			TeachersFile file = objectMapper.readValue(in, TeachersFile.class);
			if (file.getTeachers() == null) {
				throw new IllegalStateException("No 'teachers' array in " + resource.getDescription());
			}
			for (Teacher teacher : file.getTeachers()) {
				if (teacher.getUsername() == null || teacher.getPassword() == null) {
					throw new IllegalStateException("Teacher entry without username or password in "
							+ resource.getDescription());
				}
			}
			return file.getTeachers();
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read teachers from " + resource.getDescription(), e);
		}
	}

	@Data
	@JsonIgnoreProperties(ignoreUnknown = true)
	static class TeachersFile {
		private List<Teacher> teachers = new ArrayList<>();
	}

}
