package org.pubkit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PubkitApplication {

    public static void main(String[] args) {
        SpringApplication.run(PubkitApplication.class, args);
    }
}
