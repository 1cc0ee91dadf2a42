package com.hyperhook.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HyperhookApplication {
	public static void main(String[] args) {
		SpringApplication.run(HyperhookApplication.class, args);
	}
}
