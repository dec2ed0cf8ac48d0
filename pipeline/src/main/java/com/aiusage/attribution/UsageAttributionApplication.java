package com.aiusage.attribution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

/**
 * AI Usage Attribution Pipeline
 *
 * Daily batch that turns vendor usage and billing reports for Cursor, the
 * Anthropic API, Claude Code and claude.ai into user-attributed usage and cost facts.
 */
@SpringBootApplication
@EnableCaching
public class UsageAttributionApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(UsageAttributionApplication.class, args)));
    }
}
