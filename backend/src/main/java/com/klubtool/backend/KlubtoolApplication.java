package com.klubtool.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KlubtoolApplication {

	public static void main(String[] args) {
		// Calendar timestamps and audit columns are all UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(KlubtoolApplication.class, args);
	}

}
