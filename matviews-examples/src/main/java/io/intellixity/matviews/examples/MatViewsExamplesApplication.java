package io.intellixity.matviews.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class MatViewsExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(MatViewsExamplesApplication.class, args);
  }
}
