package com.assettrack.setracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeTrackerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SeTrackerApplication.class, args);
	}

}
