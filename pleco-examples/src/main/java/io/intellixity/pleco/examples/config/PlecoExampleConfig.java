package io.intellixity.pleco.examples.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.pleco.compile.CompilerOptions;
import io.intellixity.pleco.compile.QueryCompiler;
import io.intellixity.pleco.examples.service.VehicleSearchService;
import io.intellixity.pleco.jdbc.JdbcQueryExecutor;
import io.intellixity.pleco.jdbc.dialect.SqlDialect;
import io.intellixity.pleco.jdbc.postgres.PostgresDialect;
import io.intellixity.pleco.query.PageDefaults;
import io.intellixity.pleco.schema.FilterSchema;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(PlecoProperties.class)
public class PlecoExampleConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(PlecoProperties props) {
    PlecoProperties.Db db = props.getDb();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing pleco.db.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setReadOnly(true);
    return new HikariDataSource(hc);
  }

  @Bean
  public SqlDialect sqlDialect() {
    return new PostgresDialect();
  }

  @Bean
  public QueryCompiler queryCompiler(PlecoProperties props) {
    CompilerOptions options = CompilerOptions.DEFAULT
        .withResourceIdColumn(props.getResourceIdColumn())
        .withUnknownFieldPolicy(props.getUnknownFieldPolicy())
        .withPageDefaults(new PageDefaults(props.getDefaultOffset()));
    return new QueryCompiler(options);
  }

  @Bean
  public JdbcQueryExecutor jdbcQueryExecutor(DataSource dataSource) {
    return new JdbcQueryExecutor(dataSource);
  }

  @Bean
  public FilterSchema vehicleFilterSchema(PlecoProperties props) {
    return VehicleSearchService.schema(props.isSingleOperator());
  }

  @Bean
  public VehicleSearchService vehicleSearchService(SqlDialect dialect, QueryCompiler compiler, JdbcQueryExecutor executor,
                                                   FilterSchema vehicleFilterSchema) {
    return new VehicleSearchService(dialect, compiler, executor, vehicleFilterSchema);
  }
}
