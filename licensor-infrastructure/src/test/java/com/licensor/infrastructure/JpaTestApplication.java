package com.licensor.infrastructure;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Boot configuration for slice tests in this module.
 */
@SpringBootApplication
public class JpaTestApplication {
}
