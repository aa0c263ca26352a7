package com.callshield;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CallShield - live call fraud scoring, persona hand-off and evidence packaging.
 */
@SpringBootApplication
@EnableScheduling
public class CallShieldApplication {

	public static void main(String[] args) {
		SpringApplication.run(CallShieldApplication.class, args);
	}

}
