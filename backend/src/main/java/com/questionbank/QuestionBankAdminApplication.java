package com.questionbank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Question bank admin back end: LaTeX delimiter repair for question text.
 */
@SpringBootApplication
public class QuestionBankAdminApplication {

	public static void main(String[] args) {
		SpringApplication.run(QuestionBankAdminApplication.class, args);
	}

}
