package com.yunhwan.loglens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogLensApplication {

	public static void main(String[] args) {
		SpringApplication.run(LogLensApplication.class, args);
	}

}
