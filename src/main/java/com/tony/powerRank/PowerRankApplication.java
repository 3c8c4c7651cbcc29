package com.tony.powerRank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PowerRankApplication {

	public static void main(String[] args) {
		SpringApplication.run(PowerRankApplication.class, args);
	}

}
