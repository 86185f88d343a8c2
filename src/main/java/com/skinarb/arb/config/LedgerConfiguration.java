package com.skinarb.arb.config;

import com.skinarb.arb.core.InMemoryTicketLedger;
import com.skinarb.arb.core.TicketLedger;
import com.skinarb.arb.infra.JsonLinesTicketLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Slf4j
@Configuration
public class LedgerConfiguration {

    @Bean
    public TicketLedger ticketLedger(@Value("${arb.ledger.file:}") String ledgerFile) {
        if (ledgerFile == null || ledgerFile.isBlank()) {
            log.info("Ticket ledger kept in memory only");
            return new InMemoryTicketLedger();
        }
        log.info("Ticket ledger persisted to {}", ledgerFile);
        return new JsonLinesTicketLedger(Path.of(ledgerFile));
    }
}
