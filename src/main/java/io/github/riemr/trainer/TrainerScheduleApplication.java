package io.github.riemr.trainer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrainerScheduleApplication {

	public static void main(String[] args) {
		SpringApplication.run(TrainerScheduleApplication.class, args);
	}

}
