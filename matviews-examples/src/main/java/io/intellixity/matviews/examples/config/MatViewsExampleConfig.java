package io.intellixity.matviews.examples.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.matviews.exec.MatViewEngine;
import io.intellixity.matviews.jdbc.JdbcMatViewEngine;
import io.intellixity.matviews.jdbc.store.JdbcDefinitionStore;
import io.intellixity.matviews.jdbc.store.JdbcRunStore;
import io.intellixity.matviews.jdbc.store.JdbcStoreSchema;
import io.intellixity.matviews.jobs.CreateViewJob;
import io.intellixity.matviews.jobs.DeleteViewJob;
import io.intellixity.matviews.jobs.JobAdapter;
import io.intellixity.matviews.jobs.JobAdapterKind;
import io.intellixity.matviews.jobs.JobAdapters;
import io.intellixity.matviews.jobs.JobRegistry;
import io.intellixity.matviews.jobs.MatViewJobs;
import io.intellixity.matviews.jobs.MatViewsConfig;
import io.intellixity.matviews.jobs.RefreshViewJob;
import io.intellixity.matviews.store.DefinitionStore;
import io.intellixity.matviews.store.RunStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(MatViewsProperties.class)
public class MatViewsExampleConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(MatViewsProperties props) {
    MatViewsProperties.Db db = props.getDb();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing matviews.db.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaxPoolSize());
    // CONCURRENTLY statements must run outside a transaction block.
    hc.setAutoCommit(true);
    HikariDataSource ds = new HikariDataSource(hc);
    if (props.isInstallSchema()) JdbcStoreSchema.install(ds);
    return ds;
  }

  @Bean
  public MatViewsConfig matViewsConfig(MatViewsProperties props) {
    return new MatViewsConfig(JobAdapterKind.fromId(props.getJobAdapter()), props.getJobQueue(), props.getWorkerThreads());
  }

  @Bean
  public RunStore runStore(HikariDataSource ds, ObjectMapper mapper) {
    return new JdbcRunStore(ds, mapper);
  }

  @Bean
  public DefinitionStore definitionStore(HikariDataSource ds, ObjectMapper mapper) {
    return new JdbcDefinitionStore(ds, mapper);
  }

  @Bean
  public MatViewEngine matViewEngine(HikariDataSource ds) {
    return new JdbcMatViewEngine(ds);
  }

  @Bean
  public JobRegistry jobRegistry(DefinitionStore definitions, RunStore runs, MatViewEngine engine) {
    Clock clock = Clock.systemUTC();
    return JobRegistry.of(
        new CreateViewJob(definitions, runs, engine, clock),
        new RefreshViewJob(definitions, runs, engine, clock),
        new DeleteViewJob(definitions, runs, engine, clock));
  }

  @Bean
  public JobAdapter jobAdapter(MatViewsConfig config, JobRegistry registry) {
    // Spring closes AutoCloseable beans (the executor adapter) on shutdown.
    return JobAdapters.create(config, registry);
  }

  @Bean
  public MatViewJobs matViewJobs(JobAdapter adapter, MatViewsConfig config) {
    return new MatViewJobs(adapter, config);
  }
}
