package com.myorg.normparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NormativeTermsParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(NormativeTermsParserApplication.class, args);
    }
}
