package org.budgetanalyzer.converter.config;

import javax.sql.DataSource;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;

/**
 * ShedLock configuration so the history retention purge runs on one instance at a time.
 *
 * <p>Locks live in the {@code shedlock} table, created by Flyway migration {@code V2}:
 *
 * <pre>
 * CREATE TABLE shedlock (
 *   name VARCHAR(64) PRIMARY KEY,
 *   lock_until TIMESTAMP NOT NULL,
 *   locked_at TIMESTAMP NOT NULL,
 *   locked_by VARCHAR(255) NOT NULL
 * );
 * </pre>
 *
 * @see net.javacrumbs.shedlock.spring.annotation.SchedulerLock
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

  @Bean
  public LockProvider lockProvider(DataSource dataSource) {
    return new JdbcTemplateLockProvider(dataSource);
  }
}
