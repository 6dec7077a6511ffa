package io.b2mash.b2b.cantonaltax;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CantonalTaxApplication {

  public static void main(String[] args) {
    SpringApplication.run(CantonalTaxApplication.class, args);
  }
}
