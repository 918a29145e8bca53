package com.mergington.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.mergington.config.ActivityServerProperties;
import com.mergington.exception.AuthenticationRequiredException;
import com.mergington.exception.InvalidCredentialsException;
import com.mergington.model.Teacher;
import com.mergington.registry.TeacherSessionRegistry;
import com.mergington.repository.TeacherRepository;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AuthServiceTest {

	private TeacherRepository teacherRepository;
	private TeacherSessionRegistry sessionRegistry;
	private AuthService authService;

	@BeforeEach
	void setUp() {
		teacherRepository = mock(TeacherRepository.class);
		sessionRegistry = new TeacherSessionRegistry();
		authService = new AuthService(teacherRepository, sessionRegistry,
				new ActivityServerProperties("classpath:teachers.json", "classpath:activities.json", 32));

		given(teacherRepository.findByUsername("teacher1"))
				.willReturn(Optional.of(new Teacher("teacher1", "password1")));
		given(teacherRepository.findByUsername("teacher2"))
				.willReturn(Optional.of(new Teacher("teacher2", "password2")));
		given(teacherRepository.findByUsername("nobody")).willReturn(Optional.empty());
	}

	@Nested
	@DisplayName("login")
	class Login {

		@Test
		@DisplayName("valid credentials open a session for that teacher")
		void validCredentials() {
			String token = authService.login("teacher1", "password1");

			assertThat(token).isNotBlank();
			assertThat(authService.verify(token)).contains("teacher1");
			assertThat(sessionRegistry.getActiveSessionCount()).isEqualTo(1);
		}

		@Test
		@DisplayName("token is url-safe and carries 32 random bytes")
		void tokenShape() {
			String token = authService.login("teacher1", "password1");

			// 32 bytes, base64 without padding
			assertThat(token).hasSize(43).matches("[A-Za-z0-9_-]+");
		}

		@Test
		@DisplayName("repeated logins get distinct tokens")
		void distinctTokens() {
			Set<String> tokens = new HashSet<>();
			for (int i = 0; i < 50; i++) {
				tokens.add(authService.login("teacher1", "password1"));
			}

			assertThat(tokens).hasSize(50);
			assertThat(sessionRegistry.getActiveSessionCount()).isEqualTo(50);
		}

		@Test
		@DisplayName("wrong password is rejected and creates no session")
		void wrongPassword() {
			assertThatThrownBy(() -> authService.login("teacher1", "password2"))
					.isInstanceOf(InvalidCredentialsException.class)
					.hasMessage("Invalid credentials");

			assertThat(sessionRegistry.getActiveSessionCount()).isZero();
		}

		@Test
		@DisplayName("unknown user is rejected and creates no session")
		void unknownUser() {
			assertThatThrownBy(() -> authService.login("nobody", "password1"))
					.isInstanceOf(InvalidCredentialsException.class);

			assertThat(sessionRegistry.getActiveSessionCount()).isZero();
		}
	}

	@Nested
	@DisplayName("logout")
	class Logout {

		@Test
		@DisplayName("token no longer verifies after logout")
		void endsSession() {
			String token = authService.login("teacher1", "password1");

			authService.logout(token);

			assertThat(authService.verify(token)).isEmpty();
		}

		@Test
		@DisplayName("other sessions survive")
		void keepsOtherSessions() {
			String first = authService.login("teacher1", "password1");
			String second = authService.login("teacher2", "password2");

			authService.logout(first);

			assertThat(authService.verify(second)).contains("teacher2");
		}

		@Test
		@DisplayName("unknown, repeated or missing tokens are ignored")
		void idempotent() {
			String token = authService.login("teacher1", "password1");
			authService.logout(token);

			authService.logout(token);
			authService.logout("never-issued");
			authService.logout(null);

			assertThat(sessionRegistry.getActiveSessionCount()).isZero();
		}
	}

	@Nested
	@DisplayName("verify / requireTeacher")
	class Verify {

		@Test
		void missingOrUnknownTokenIsAnonymous() {
			assertThat(authService.verify(null)).isEmpty();
			assertThat(authService.verify("bogus")).isEmpty();
		}

		@Test
		void requireTeacherReturnsUsername() {
			String token = authService.login("teacher2", "password2");

			assertThat(authService.requireTeacher(token, "register")).isEqualTo("teacher2");
		}

		@Test
		void requireTeacherRejectsAnonymous() {
			assertThatThrownBy(() -> authService.requireTeacher(null, "unregister"))
					.isInstanceOf(AuthenticationRequiredException.class)
					.hasMessage("Authentication required. Only teachers can unregister students.");
		}
	}

	@Nested
	@DisplayName("extractToken")
	class ExtractToken {

		@Test
		void stripsBearerPrefix() {
			assertThat(AuthService.extractToken("Bearer abc123")).contains("abc123");
		}

		@Test
		void rawValueIsTakenAsToken() {
			assertThat(AuthService.extractToken("abc123")).contains("abc123");
		}

		@Test
		void missingOrBlankHeaderGivesNothing() {
			assertThat(AuthService.extractToken(null)).isEmpty();
			assertThat(AuthService.extractToken("   ")).isEmpty();
			assertThat(AuthService.extractToken("Bearer ")).isEmpty();
		}
	}
}
