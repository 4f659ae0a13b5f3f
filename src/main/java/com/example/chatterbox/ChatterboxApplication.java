package com.example.chatterbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Chatterbox message board API.
 *
 * <p>Bootstraps the Spring Boot context, wires the message store and its
 * HTTP handlers, and starts the embedded web server.</p>
 */
@SpringBootApplication
public class ChatterboxApplication {

	/**
	 * Starts the Spring Boot application.
	 *
	 * @param args command-line arguments passed to the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(ChatterboxApplication.class, args);
	}

}
