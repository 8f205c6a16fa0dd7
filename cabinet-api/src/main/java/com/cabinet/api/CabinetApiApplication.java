package com.cabinet.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.cabinet")
@EnableJpaRepositories(basePackages = "com.cabinet")
@EntityScan(basePackages = "com.cabinet")
@ConfigurationPropertiesScan(basePackages = "com.cabinet")
public class CabinetApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(CabinetApiApplication.class, args);
  }
}
