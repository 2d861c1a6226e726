package com.conveyal.catstronauts.graphql;

import com.conveyal.catstronauts.datasource.FetchException;
import graphql.ErrorType;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.execution.DataFetcherExceptionHandler;
import graphql.execution.DataFetcherExceptionHandlerParameters;
import graphql.execution.DataFetcherExceptionHandlerResult;
import graphql.execution.ResultPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns a failed field into an error entry carrying the field path and the kind of failure. The field itself
 * resolves to null and the rest of the response is unaffected.
 */
public class FetchErrorHandler implements DataFetcherExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(FetchErrorHandler.class);

    public static final String KIND = "kind";
    public static final String STATUS = "status";
    public static final String URL = "url";
    public static final String INTERNAL = "INTERNAL";

    @Override
    public CompletableFuture<DataFetcherExceptionHandlerResult> handleException(
        DataFetcherExceptionHandlerParameters parameters
    ) {
        Throwable exception = unwrap(parameters.getException());
        ResultPath path = parameters.getPath();
        Map<String, Object> extensions = new LinkedHashMap<>();
        if (exception instanceof FetchException) {
            FetchException fetchException = (FetchException) exception;
            extensions.put(KIND, fetchException.errorType.name());
            if (fetchException.status != null) extensions.put(STATUS, fetchException.status);
            extensions.put(URL, fetchException.url);
            LOG.warn("Could not resolve {}: {}", path, fetchException.getMessage());
        } else {
            extensions.put(KIND, INTERNAL);
            LOG.error("Unexpected error resolving {}", path, exception);
        }
        String message = exception.getMessage() == null ? exception.toString() : exception.getMessage();
        GraphQLError error = GraphqlErrorBuilder.newError()
            .message("%s", message)
            .path(path)
            .location(parameters.getSourceLocation())
            .errorType(ErrorType.DataFetchingException)
            .extensions(extensions)
            .build();
        return CompletableFuture.completedFuture(DataFetcherExceptionHandlerResult.newResult().error(error).build());
    }

    /** Failures of asynchronous fetchers arrive wrapped by the future that carried them. */
    private static Throwable unwrap(Throwable exception) {
        Throwable current = exception;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
