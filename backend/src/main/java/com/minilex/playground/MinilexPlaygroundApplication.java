package com.minilex.playground;

import com.minilex.playground.config.ScannerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ScannerProperties.class)
public class MinilexPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(MinilexPlaygroundApplication.class, args);
    }
}
