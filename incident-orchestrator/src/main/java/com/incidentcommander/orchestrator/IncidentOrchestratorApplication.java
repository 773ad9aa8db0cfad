package com.incidentcommander.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.incidentcommander")
public class IncidentOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentOrchestratorApplication.class, args);
    }
}
