package dev.valor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Valor evaluation service.
 *
 * <p>Serves filter queries and evaluation jobs over REST on port 8080; evaluations are computed on
 * a background pool.
 */
@SpringBootApplication
public class ValorApplication {
  public static void main(String[] args) {
    SpringApplication.run(ValorApplication.class, args);
  }
}
