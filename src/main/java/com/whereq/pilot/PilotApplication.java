package com.whereq.pilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ Pilot.
 * This service keeps an HTCondor or SLURM cluster supplied with pilot jobs
 * for the tasks of a remote queue service, and reconciles the two.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class PilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PilotApplication.class, args);
    }
}
