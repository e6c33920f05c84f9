package net.lightapi.endpoint.db;

import com.networknt.config.Config;
import com.networknt.server.StartupHookProvider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start up hook that creates the shared datasource used by the provider queries. Callers that manage
 * their own connections do not need it.
 */
public class SqlDbStartupHook implements StartupHookProvider {
    private static final Logger logger = LoggerFactory.getLogger(SqlDbStartupHook.class);
    static DbConfig config = (DbConfig)Config.getInstance().getJsonObjectConfig(DbConfig.CONFIG_NAME, DbConfig.class);
    // shared datasource that can be used to get a database connection.
    public static HikariDataSource ds;

    @Override
    public void onStartup() {
        logger.info("SqlDbStartupHook begins");
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setDriverClassName(config.getDriverClassName());
        hikariConfig.setUsername(config.getUsername());
        hikariConfig.setPassword(config.getPassword());
        hikariConfig.setJdbcUrl(config.getJdbcUrl());
        if(logger.isTraceEnabled()) logger.trace("jdbcUrl = " + config.getJdbcUrl());
        if (config.getMaximumPoolSize() > 0) {
            hikariConfig.setMaximumPoolSize(config.getMaximumPoolSize());
        }
        ds = new HikariDataSource(hikariConfig);
        logger.info("SqlDbStartupHook ends");
    }
}
