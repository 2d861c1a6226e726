package com.conveyal.catstronauts.graphql;

import com.conveyal.catstronauts.ServiceConfig;
import com.conveyal.catstronauts.datasource.HttpTransport;
import com.conveyal.catstronauts.model.EntityModelRegistry;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.ExecutionInput;
import graphql.ExecutionResult;
import graphql.GraphQL;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Executes GraphQL queries against the remote catalogue. One instance is built at startup and shared; the schema,
 * resolver map and model registry it holds are immutable. Every call to {@link #run} gets its own
 * {@link RequestContext}, so data cached while answering one query is never visible to another.
 */
public class CatstronautsGraphQL {

    private static final Logger LOG = LoggerFactory.getLogger(CatstronautsGraphQL.class);

    private final ServiceConfig config;
    private final HttpTransport transport;
    private final Executor executor;
    private final ObjectMapper mapper;
    private final GraphQLSchema schema;
    private final GraphQL graphQL;

    public CatstronautsGraphQL(ServiceConfig config, HttpTransport transport, Executor executor) {
        this(config, transport, executor, GraphQLCatstronautsSchema.resolverMap(), EntityModelRegistry.catstronauts());
    }

    /**
     * @param executor runs the remote fetches, so that several can be in flight while the query is being resolved.
     * @throws com.conveyal.catstronauts.model.ModelMismatchException if the resolvers and registry do not cover
     *         every exposed field.
     */
    public CatstronautsGraphQL(
        ServiceConfig config,
        HttpTransport transport,
        Executor executor,
        ResolverMap resolvers,
        EntityModelRegistry registry
    ) {
        this.config = config;
        this.transport = transport;
        this.executor = executor;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.schema = GraphQLCatstronautsSchema.build(resolvers, registry);
        this.graphQL = GraphQL.newGraphQL(schema)
            .defaultDataFetcherExceptionHandler(new FetchErrorHandler())
            .build();
        LOG.info("GraphQL schema ready, remote catalogue at {}", config);
    }

    /**
     * Execute a GraphQL query and return the result as a map in the shape of the GraphQL response specification
     * (data, and errors if there were any). The map is typically converted to JSON by the caller.
     *
     * @param query the GraphQL query text
     * @param variables values for the query's variables, may be null
     */
    public Map<String, Object> run(String query, Map<String, Object> variables) {
        return execute(query, variables).toSpecification();
    }

    public ExecutionResult execute(String query, Map<String, Object> variables) {
        // Built anew for each execution: the data sources inside cache what they fetch.
        RequestContext context = newRequestContext();
        ExecutionResult result = graphQL.execute(
            ExecutionInput.newExecutionInput()
                .query(query)
                .variables(variables == null ? Map.<String, Object>of() : variables)
                .graphQLContext(Map.<Object, Object>of(RequestContext.class, context))
                .build()
        );
        LOG.debug("Query finished with {} errors, {} remote calls",
            result.getErrors().size(), context.trackAPI.resource().fetchCount());
        return result;
    }

    RequestContext newRequestContext() {
        return RequestContext.create(config.baseUrl, transport, mapper, executor);
    }

    public GraphQLSchema schema() {
        return schema;
    }

    /** The schema in SDL form. */
    public String printSchema() {
        return new SchemaPrinter().print(schema);
    }
}
