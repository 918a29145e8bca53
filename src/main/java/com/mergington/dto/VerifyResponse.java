package com.mergington.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerifyResponse {

	private boolean authenticated;
	private String username;

	public static VerifyResponse anonymous() {
		return new VerifyResponse(false, null);
	}

}
