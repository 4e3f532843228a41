package keystone.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("keystone.platform.config")
public class KeystoneApplication {

  public static void main(String[] args) {
    SpringApplication.run(KeystoneApplication.class, args);
  }
}
