package de.conciso.nfeimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NfeImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(NfeImportApplication.class, args);
    }
}
