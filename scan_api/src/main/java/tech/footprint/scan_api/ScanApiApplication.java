package tech.footprint.scan_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScanApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanApiApplication.class, args);
    }
}
