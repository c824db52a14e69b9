package io.nightly.standards.dump;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nightly.core.config.Config;
import io.nightly.core.config.ConfigException;
import io.nightly.spi.DumpProvider;
import io.nightly.spi.DumpProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Locale.ENGLISH;

/**
 * Opens a new connection for each dump from {@code database.*} settings.
 *
 * {@code database.type} is {@code mysql} or {@code jdbc}. When it is not set
 * it is derived from the url.
 */
public class JdbcDumpProviderFactory
        implements DumpProviderFactory
{
    private static final Logger logger = LoggerFactory.getLogger(JdbcDumpProviderFactory.class);

    private final String type;
    private final Optional<String> url;
    private final Optional<String> user;
    private final Optional<String> password;

    @Inject
    public JdbcDumpProviderFactory(Config systemConfig)
    {
        this.url = systemConfig.getOptional("database.url", String.class);
        this.user = systemConfig.getOptional("database.user", String.class);
        this.password = systemConfig.getOptional("database.password", String.class);
        Optional<String> configuredType = systemConfig.getOptional("database.type", String.class);
        if (configuredType.isPresent()) {
            this.type = configuredType.get().trim().toLowerCase(ENGLISH);
        }
        else {
            this.type = defaultType(url);
        }
        if (!this.type.equals("mysql") && !this.type.equals("jdbc")) {
            throw new ConfigException("Unsupported database.type: " + this.type + " (expected mysql or jdbc)");
        }
    }

    private static String defaultType(Optional<String> url)
    {
        if (url.isPresent() && (url.get().startsWith("jdbc:mysql:") || url.get().startsWith("jdbc:mariadb:"))) {
            return "mysql";
        }
        return "jdbc";
    }

    @Override
    public String getType()
    {
        return type;
    }

    @Override
    public DumpProvider open()
    {
        if (!url.isPresent()) {
            throw new ConfigException("database.url is not set");
        }
        Properties props = new Properties();
        if (user.isPresent()) {
            props.setProperty("user", user.get());
        }
        if (password.isPresent()) {
            props.setProperty("password", password.get());
        }

        Connection connection;
        try {
            connection = DriverManager.getConnection(url.get(), props);
        }
        catch (SQLException ex) {
            throw new DatabaseException("Failed to connect to the database", ex);
        }
        logger.debug("Connected to {} database", type);

        if (type.equals("mysql")) {
            return new MySqlDumpProvider(connection);
        }
        return new JdbcDumpProvider(connection);
    }
}
