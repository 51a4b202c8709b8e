package com.blockstore.config;

import com.blockstore.db.H2Dialect;
import com.blockstore.db.PostgresDialect;
import com.blockstore.db.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;

@Configuration
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    @Bean
    public SqlDialect sqlDialect(BlockStoreProperties properties, DataSource dataSource) throws MetaDataAccessException {
        SqlDialect dialect = switch (properties.getDialect()) {
            case POSTGRES -> new PostgresDialect();
            case H2 -> new H2Dialect();
            case AUTO -> detect(dataSource);
        };
        log.info("Using {} SQL dialect", dialect.name());
        return dialect;
    }

    private static SqlDialect detect(DataSource dataSource) throws MetaDataAccessException {
        String product = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName);
        if (product != null && product.toLowerCase().contains("h2")) {
            return new H2Dialect();
        }
        return new PostgresDialect();
    }
}
