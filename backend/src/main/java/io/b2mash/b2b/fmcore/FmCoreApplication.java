package io.b2mash.b2b.fmcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FmCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(FmCoreApplication.class, args);
  }
}
