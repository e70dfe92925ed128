package org.budgetanalyzer.converter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CurrencyConverterApplication {

  public static void main(String[] args) {
    SpringApplication.run(CurrencyConverterApplication.class, args);
  }
}
