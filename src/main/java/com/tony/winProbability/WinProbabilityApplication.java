package com.tony.winProbability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WinProbabilityApplication {

	public static void main(String[] args) {
		SpringApplication.run(WinProbabilityApplication.class, args);
	}

}
