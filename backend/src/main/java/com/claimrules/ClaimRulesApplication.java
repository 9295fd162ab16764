package com.claimrules;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ClaimRules - patent claim protection-rule extraction service.
 */
@SpringBootApplication
public class ClaimRulesApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClaimRulesApplication.class, args);
	}

}
