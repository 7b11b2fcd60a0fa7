package tech.yump.rotation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.rotation.config.RotationProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(RotationProperties.class)
public class RotationEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(RotationEngineApplication.class, args);
    log.info(">>> Rotation Engine Started <<<");
  }
}
