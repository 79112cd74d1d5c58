package org.sqlgate.cli;

import io.dropwizard.cli.ConfiguredCommand;
import io.dropwizard.setup.Bootstrap;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import org.sqlgate.SqlGateConfiguration;
import org.sqlgate.dto.QueryEnvelope;
import org.sqlgate.service.GuardedQueryService;

// Offline dry run: prints the verdict and normalized SQL for one statement
public class CheckCommand extends ConfiguredCommand<SqlGateConfiguration> {

    public CheckCommand() {
        super("check", "Validates and normalizes a SQL statement without running it");
    }

    @Override
    public void configure(Subparser subparser) {
        super.configure(subparser);
        subparser.addArgument("-s", "--sql")
                .dest("sql")
                .required(true)
                .help("SQL statement to check");
    }

    @Override
    protected void run(Bootstrap<SqlGateConfiguration> bootstrap, Namespace namespace, SqlGateConfiguration cfg) throws Exception {
        GuardedQueryService service = new GuardedQueryService(cfg.toPolicy(), null);
        QueryEnvelope env = service.check(namespace.getString("sql"));
        System.out.println(bootstrap.getObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(env));
    }
}
