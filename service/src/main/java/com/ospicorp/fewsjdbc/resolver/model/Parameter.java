package com.ospicorp.fewsjdbc.resolver.model;

/**
 * A parameter offered by a filter; {@code name} is the owning filter's name.
 */
public record Parameter(String parameterId, String parameter, String name) {}
