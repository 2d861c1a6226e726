package com.conveyal.catstronauts;

import com.conveyal.catstronauts.datasource.ApacheHttpTransport;
import com.conveyal.catstronauts.datasource.HttpTransport;
import com.conveyal.catstronauts.graphql.CatstronautsGraphQL;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ForkJoinPool;

/**
 * Run one GraphQL query against the remote catalogue and print the JSON result.
 */
public class CatstronautsMain {

    private static final Logger LOG = LoggerFactory.getLogger(CatstronautsMain.class);

    /** The query behind the home page grid. */
    public static final String HOME_QUERY = String.join("\n",
        "query GetTracks {",
        "  tracksForHome {",
        "    id",
        "    title",
        "    thumbnail",
        "    length",
        "    modulesCount",
        "    author {",
        "      id",
        "      name",
        "      photo",
        "    }",
        "  }",
        "}"
    );

    public static void main (String[] args) throws Exception {
        ServiceConfig config = ServiceConfig.load();
        try (ApacheHttpTransport transport = new ApacheHttpTransport(config)) {
            run(args, config, transport, System.out);
        }
    }

    /**
     * Parse the command line and carry it out, fetching through the given transport and printing to the given
     * stream. The base URL option, if present, replaces the one in the configuration.
     */
    public static void run (String[] args, ServiceConfig config, HttpTransport transport, PrintStream out)
            throws ParseException, IOException {
        Options options = getOptions();
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);
        String[] arguments = cmd.getArgs();
        if (cmd.hasOption("help")) {
            printHelp(options, out);
            return;
        }
        if (cmd.hasOption("base-url")) {
            config = config.withBaseUrl(cmd.getOptionValue("base-url"));
        }
        ObjectMapper mapper = new ObjectMapper();
        CatstronautsGraphQL graphQL = new CatstronautsGraphQL(config, transport, ForkJoinPool.commonPool());
        if (cmd.hasOption("schema")) {
            out.print(graphQL.printSchema());
            return;
        }
        String query = HOME_QUERY;
        if (arguments.length >= 1) {
            File queryFile = new File(arguments[0]);
            LOG.info("Reading query from {}", queryFile.getAbsolutePath());
            query = FileUtils.readFileToString(queryFile, StandardCharsets.UTF_8);
        }
        Map<String, Object> variables = new HashMap<>();
        if (cmd.hasOption("variables")) {
            variables = mapper.readValue(cmd.getOptionValue("variables"), new TypeReference<Map<String, Object>>() { });
        }
        Map<String, Object> result = graphQL.run(query, variables);
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }

    private static void printHelp (Options options, PrintStream out) {
        final String HELP = String.join("\n",
                "java -jar catstronauts-graphql.jar [options] [QUERY.graphql]",
                "Resolve a GraphQL query against the Catstronauts catalogue REST API and print",
                "the result as JSON. Without a query file, the home page query is run.",
                "", // blank lines for legibility
                ""
        );
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(out);
        writer.println(HELP);
        formatter.printHelp(writer, formatter.getWidth(), "catstronauts-graphql", null, options,
            formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
        writer.println();
        writer.flush();
    }

    private static Options getOptions () {
        Options options = new Options();
        options.addOption(Option.builder("h").longOpt("help").desc("print this message").build());
        options.addOption(Option.builder()
                .longOpt("base-url").hasArg()
                .desc("base URL of the catalogue REST API, overrides " + ServiceConfig.BASE_URL)
                .build());
        options.addOption(Option.builder()
                .longOpt("variables").hasArg()
                .desc("query variables as a JSON object")
                .build());
        options.addOption(Option.builder()
                .longOpt("schema")
                .desc("print the GraphQL schema instead of running a query")
                .build());
        return options;
    }
}
