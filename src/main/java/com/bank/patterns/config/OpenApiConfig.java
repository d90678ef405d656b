package com.bank.patterns.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI patternDiscoveryOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pattern Discovery API")
                        .version("1.0.0")
                        .description(
                                "Predicts missing debit accounts, credit accounts and reference codes on " +
                                "ledger transactions from patterns mined out of each tenant's history.\n\n" +
                                "**Prediction Pipeline:**\n" +
                                "1. Submit transactions via `POST /predictions/{tenantId}`\n" +
                                "2. Load the tenant's pattern set from the cache (memory, Aerospike, local file)\n" +
                                "3. On a miss, refresh incrementally from the last mining run or re-mine the last 730 days\n" +
                                "4. Fill each missing field with the best keyword match and record its confidence\n" +
                                "5. Return copies of the transactions with a per-family prediction report\n\n" +
                                "**Pattern Families:**\n" +
                                "- `DEBIT` predicts the debit account when the credit side is a bank account\n" +
                                "- `CREDIT` predicts the credit account when the debit side is a bank account\n" +
                                "- `REFERENCE` predicts the reference code from description keywords")
                        .contact(new Contact().name("Pattern Discovery Team")));
    }
}
