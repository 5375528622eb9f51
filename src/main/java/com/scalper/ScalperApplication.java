package com.scalper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScalperApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScalperApplication.class, args);
	}
}
