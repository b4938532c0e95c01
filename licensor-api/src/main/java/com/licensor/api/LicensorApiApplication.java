package com.licensor.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.licensor")
@EnableJpaRepositories(basePackages = "com.licensor")
@EntityScan(basePackages = "com.licensor")
@ConfigurationPropertiesScan(basePackages = "com.licensor")
public class LicensorApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(LicensorApiApplication.class, args);
  }
}
