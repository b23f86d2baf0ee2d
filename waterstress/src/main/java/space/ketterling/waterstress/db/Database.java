package space.ketterling.waterstress.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.waterstress.config.AppConfig;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {

    /**
     * Utility class; no instances.
     */
    private Database() {
    }

    /**
     * Builds the pool used by the feature table sink.
     */
    public static HikariDataSource createSinkDataSource(AppConfig cfg) {
        return createDataSource(cfg.dbJdbcUrl(), cfg.dbUsername(), cfg.dbPassword(), "sink", cfg.dbPoolMax());
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    static HikariDataSource createDataSource(String jdbcUrl, String user, String password, String role,
            int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(jdbcUrl);
        if (user != null && !user.isBlank())
            hc.setUsername(user);
        if (password != null && !password.isBlank())
            hc.setPassword(password);
        hc.setPoolName("waterstress-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
