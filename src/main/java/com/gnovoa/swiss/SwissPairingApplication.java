// Namespace
package com.gnovoa.swiss;

// Imports
import com.gnovoa.swiss.runner.PairingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(PairingProperties.class)
public class SwissPairingApplication {

  public static void main(String[] args) {
    SpringApplication.run(SwissPairingApplication.class, args);
  }
}
