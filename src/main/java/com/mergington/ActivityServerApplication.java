package com.mergington;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ActivityServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ActivityServerApplication.class, args);
	}

}
