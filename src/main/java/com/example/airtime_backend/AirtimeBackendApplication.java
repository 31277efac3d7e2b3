package com.example.airtime_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AirtimeBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(AirtimeBackendApplication.class, args);
	}

}
