package com.mergington.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Teacher {

	private String username;

	@ToString.Exclude
	private String password;

}
