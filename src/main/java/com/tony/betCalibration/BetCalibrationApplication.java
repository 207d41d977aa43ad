package com.tony.betCalibration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BetCalibrationApplication {

	public static void main(String[] args) {
		SpringApplication.run(BetCalibrationApplication.class, args);
	}

}
