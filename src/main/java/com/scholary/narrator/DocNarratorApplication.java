package com.scholary.narrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;

@SpringBootApplication
public class DocNarratorApplication {

  public static void main(String[] args) {
    ConfigurableApplicationContext context =
        SpringApplication.run(DocNarratorApplication.class, args);

    // One-shot conversion: shut down once the runner is done
    if (context.getEnvironment().acceptsProfiles(Profiles.of("cli"))) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
