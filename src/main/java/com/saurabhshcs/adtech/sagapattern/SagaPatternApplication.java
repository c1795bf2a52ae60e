package com.saurabhshcs.adtech.sagapattern;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SagaPatternApplication {

	public static void main(String[] args) {
		SpringApplication.run(SagaPatternApplication.class, args);
	}

}
