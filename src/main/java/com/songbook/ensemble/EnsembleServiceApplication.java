package com.songbook.ensemble;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EnsembleServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(EnsembleServiceApplication.class, args);
	}
}
