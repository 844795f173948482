package com.mediai.mediai_agents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class MediaiAgentsApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(MediaiAgentsApplication.class, args);
        // CLI mode runs a single workflow; propagate its exit code instead of serving HTTP
        if (context.getEnvironment().getProperty("mediai.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
