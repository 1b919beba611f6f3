package io.intellixity.pleco.examples.config;

import io.intellixity.pleco.compile.UnknownFieldPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pleco")
public class PlecoProperties {
  private final Db db = new Db();
  private String resourceIdColumn = "id";
  private UnknownFieldPolicy unknownFieldPolicy = UnknownFieldPolicy.REJECT;
  private int defaultOffset = 0;
  /** Reject field objects that carry more than one operator. */
  private boolean singleOperator = false;

  public Db getDb() { return db; }
  public String getResourceIdColumn() { return resourceIdColumn; }
  public void setResourceIdColumn(String resourceIdColumn) { this.resourceIdColumn = resourceIdColumn; }
  public UnknownFieldPolicy getUnknownFieldPolicy() { return unknownFieldPolicy; }
  public void setUnknownFieldPolicy(UnknownFieldPolicy unknownFieldPolicy) { this.unknownFieldPolicy = unknownFieldPolicy; }
  public int getDefaultOffset() { return defaultOffset; }
  public void setDefaultOffset(int defaultOffset) { this.defaultOffset = defaultOffset; }
  public boolean isSingleOperator() { return singleOperator; }
  public void setSingleOperator(boolean singleOperator) { this.singleOperator = singleOperator; }

  public static class Db {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }
}
