package io.condoinsight.warehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the condo transaction warehouse loader.
 *
 * Reads URA private-residential transaction CSV exports, stages and validates
 * them, and promotes them into the PostgreSQL warehouse with batch-level audit
 * and row-hash idempotency.
 */
@SpringBootApplication
public class WarehouseLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(WarehouseLoaderApplication.class, args)
        ));
    }
}
