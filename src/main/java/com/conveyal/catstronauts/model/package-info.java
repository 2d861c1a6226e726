/**
 * Backing records, i.e. the shapes the remote catalogue emits, and the registry pairing them with the GraphQL types
 * they are exposed as.
 */
package com.conveyal.catstronauts.model;
