/**
 * The GraphQL side of the catalogue: exposed types, the resolver map binding their fields, the per-request context
 * and the entry point that executes queries.
 * The HTTP layer serving these queries is not part of this project.
 */
package com.conveyal.catstronauts.graphql;
