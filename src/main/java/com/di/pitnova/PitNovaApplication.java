package com.di.pitnova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PitNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(PitNovaApplication.class, args);
	}
}
