package com.mergington.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ActivityServerPropertiesTest {

	@Test
	void rejectsNonPositiveTokenSize() {
		assertThatThrownBy(() -> new ActivityServerProperties("a", "b", 0))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("token-bytes");
	}
}
