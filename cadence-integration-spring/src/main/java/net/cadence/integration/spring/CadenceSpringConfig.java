package net.cadence.integration.spring;

import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.adapter.jdbc.repo.JdbcLogRepository;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.LogRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

/** Repositories, transactions and clock on top of the application's DataSource. */
@Configuration
public class CadenceSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // the JDBC repositories read the connection bound by the TxRunner
    @Bean public JobRepository jobRepository() { return new JdbcJobRepository(); }
    @Bean public LogRepository logRepository() { return new JdbcLogRepository(); }

    @Bean public Clock systemClock() { return Instant::now; }
}
