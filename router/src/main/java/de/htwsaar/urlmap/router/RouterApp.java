package de.htwsaar.urlmap.router;

import de.htwsaar.urlmap.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({LoggingConfig.class})
public class RouterApp {
    public static void main(String[] args) {
        SpringApplication.run(RouterApp.class, args);
    }
}
