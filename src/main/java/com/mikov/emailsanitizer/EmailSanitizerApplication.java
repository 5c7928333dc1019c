package com.mikov.emailsanitizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmailSanitizerApplication {

    public static void main(final String[] args) {
        SpringApplication.run(EmailSanitizerApplication.class, args);
    }
}
