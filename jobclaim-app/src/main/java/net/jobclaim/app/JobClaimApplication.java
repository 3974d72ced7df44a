package net.jobclaim.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class JobClaimApplication {
    public static void main(String[] args) {
        SpringApplication.run(JobClaimApplication.class, args);
    }
}
