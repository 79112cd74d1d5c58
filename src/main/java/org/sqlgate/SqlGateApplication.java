package org.sqlgate;

import io.dropwizard.Application;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.lifecycle.Managed;
import io.dropwizard.setup.Bootstrap;
import io.dropwizard.setup.Environment;
import org.sqlgate.cli.CheckCommand;
import org.sqlgate.errors.GlobalExceptionMapper;
import org.sqlgate.guard.GuardPolicy;
import org.sqlgate.health.DatabaseHealthCheck;
import org.sqlgate.repo.ConnectionSource;
import org.sqlgate.repo.DriverManagerConnectionSource;
import org.sqlgate.repo.PooledConnectionSource;
import org.sqlgate.repo.SchemaInspector;
import org.sqlgate.resources.PolicyResource;
import org.sqlgate.resources.QueryResource;
import org.sqlgate.resources.TableResource;
import org.sqlgate.service.GuardedQueryService;
import org.sqlgate.service.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SqlGateApplication extends Application<SqlGateConfiguration> {
    private static final Logger LOG = LoggerFactory.getLogger(SqlGateApplication.class);

    @Override
    public String getName() {
        return "sqlgate";
    }

    @Override
    public void initialize(Bootstrap<SqlGateConfiguration> bootstrap) {
        // ${ROW_LIMIT_CEILING:-100} style placeholders in the YAML
        bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
                bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
        bootstrap.addCommand(new CheckCommand());
    }

    @Override
    public void run(SqlGateConfiguration cfg, Environment env) {
        GuardPolicy policy = cfg.toPolicy();

        ConnectionSource connections;
        if (cfg.poolSize > 0) {
            PooledConnectionSource pool = new PooledConnectionSource(cfg.dbUrl, cfg.dbUser, cfg.dbPassword, cfg.poolSize);
            env.lifecycle().manage(pool);
            connections = pool;
        } else {
            connections = new DriverManagerConnectionSource(cfg.dbUrl, cfg.dbUser, cfg.dbPassword);
        }

        QueryExecutor executor = new QueryExecutor(connections, policy.rowLimitCeiling(), cfg.statementTimeoutMs, cfg.fetchSize);
        env.lifecycle().manage(new Managed() {
            @Override
            public void start() {
            }

            @Override
            public void stop() {
                executor.close();
            }
        });

        GuardedQueryService service = new GuardedQueryService(policy, executor);

        env.healthChecks().register("database", new DatabaseHealthCheck(connections));

        env.jersey().register(new GlobalExceptionMapper());
        env.jersey().register(new PolicyResource(policy));
        env.jersey().register(new QueryResource(service));
        env.jersey().register(new TableResource(new SchemaInspector(connections, policy)));

        LOG.info("Guard ready: rowLimitCeiling={} whitelist={} forbiddenKeywords={}",
                policy.rowLimitCeiling(),
                policy.whitelistEnabled() ? policy.schemaWhitelist() : "disabled",
                policy.forbiddenKeywords().size());
    }

    public static void main(String[] args) throws Exception {
        new SqlGateApplication().run(args);
    }
}
