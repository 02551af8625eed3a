package io.github.riemr.maintenance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MaintenanceScheduleApplication {

	public static void main(String[] args) {
		SpringApplication.run(MaintenanceScheduleApplication.class, args);
	}

}
