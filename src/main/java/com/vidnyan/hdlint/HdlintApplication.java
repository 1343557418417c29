package com.vidnyan.hdlint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * hdlint - static design-rule analyzer for process-based hardware descriptions.
 *
 * Elaborates a design, summarizes the data flow of every process and checks it for
 * incomplete sensitivity lists, inferred latches and register discipline problems.
 */
@SpringBootApplication
public class HdlintApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HdlintApplication.class, args)));
    }
}
