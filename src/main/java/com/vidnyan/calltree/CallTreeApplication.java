package com.vidnyan.calltree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AUTOSAR Call Tree Analyzer
 *
 * Scans embedded C sources into a call graph with conditional/loop/RTE metadata
 * and reports recursion.
 */
@SpringBootApplication
public class CallTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallTreeApplication.class, args);
    }
}
