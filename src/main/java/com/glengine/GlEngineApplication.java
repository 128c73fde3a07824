package com.glengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GL Engine.
 *
 * GL Engine turns business documents (invoices, bills, payments) into balanced
 * double-entry journals, enforces posting invariants and segregation of duties,
 * and governs the open/close/lock lifecycle of fiscal periods.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GlEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlEngineApplication.class, args);
    }
}
