package com.tony.baseballAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BaseballAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(BaseballAnalyticsApplication.class, args);
	}

}
