package uk.gegc.bannertracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BannerTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(BannerTrackingApplication.class, args);
    }
}
