package io.heygw44.cohort;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class CohortApplication {

    public static void main(String[] args) {
        SpringApplication.run(CohortApplication.class, args);
    }
}
