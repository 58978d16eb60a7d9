package io.nextrun;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * NextRun: a self-rescheduling agent runtime powered by Spring AI and JobRunr.
 * Each invocation runs the agent in the background and lets it decide when it runs next.
 */
@SpringBootApplication
public class NextRunApplication {

    public static void main(String[] args) {
        SpringApplication.run(NextRunApplication.class, args);
    }
}
