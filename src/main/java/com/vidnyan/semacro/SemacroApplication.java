package com.vidnyan.semacro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * semacro - explore and expand SELinux reference-policy macros.
 */
@SpringBootApplication
public class SemacroApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SemacroApplication.class, args)));
    }
}
