/**
 * Data sources: remote fetching, decoding into backing records and request-scoped caching. Nothing in here knows
 * about GraphQL.
 */
package com.conveyal.catstronauts.datasource;
