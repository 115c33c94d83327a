package teranet.mapdev.loadseries;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the load series cleaning service.
 */
@SpringBootApplication
public class LoadSeriesApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoadSeriesApplication.class, args);
    }
}
