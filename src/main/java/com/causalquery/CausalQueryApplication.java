package com.causalquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CausalQuery - nodal-type interpretation and wildcard query expansion.
 */
@SpringBootApplication
public class CausalQueryApplication {

	public static void main(String[] args) {
		SpringApplication.run(CausalQueryApplication.class, args);
	}

}
