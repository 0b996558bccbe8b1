package uk.gegc.interviewledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InterviewLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewLedgerApplication.class, args);
    }
}
