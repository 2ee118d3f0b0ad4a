package org.ofc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OfcApplication {
    public static void main(String[] args) {
        SpringApplication.run(OfcApplication.class, args);
    }
}
