package com.flagship.transaction_engine;

import com.flagship.transaction_engine.config.TransactionEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Replays a CSV file of deposits, withdrawals and disputes and prints the
 * resulting client balances as CSV on stdout.
 */
@SpringBootApplication
@EnableConfigurationProperties(TransactionEngineProperties.class)
public class TransactionEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TransactionEngineApplication.class, args)));
    }
}
