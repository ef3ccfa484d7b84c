package org.example.webverse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WebverseApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebverseApplication.class, args);
    }
}
