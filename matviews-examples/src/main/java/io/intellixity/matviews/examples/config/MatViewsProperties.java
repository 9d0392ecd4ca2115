package io.intellixity.matviews.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "matviews")
public class MatViewsProperties {
  /** inline | executor */
  private String jobAdapter = "inline";
  private String jobQueue = "default";
  private int workerThreads = 2;
  /** Create the definition/run tables on startup. */
  private boolean installSchema = true;
  private final Db db = new Db();

  public String getJobAdapter() { return jobAdapter; }
  public void setJobAdapter(String jobAdapter) { this.jobAdapter = jobAdapter; }
  public String getJobQueue() { return jobQueue; }
  public void setJobQueue(String jobQueue) { this.jobQueue = jobQueue; }
  public int getWorkerThreads() { return workerThreads; }
  public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
  public boolean isInstallSchema() { return installSchema; }
  public void setInstallSchema(boolean installSchema) { this.installSchema = installSchema; }
  public Db getDb() { return db; }

  public static class Db {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maxPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
  }
}
