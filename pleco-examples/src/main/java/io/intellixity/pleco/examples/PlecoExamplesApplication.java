package io.intellixity.pleco.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class PlecoExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(PlecoExamplesApplication.class, args);
  }
}
