package home.purpleair;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PurpleAirScraper {
    public static void main(String[] args) {
        SpringApplication.run(PurpleAirScraper.class, args);
    }
}
