package com.tribe.matching;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TribeMatchingApplication {

	public static void main(String[] args) {
		SpringApplication.run(TribeMatchingApplication.class, args);
	}

}
