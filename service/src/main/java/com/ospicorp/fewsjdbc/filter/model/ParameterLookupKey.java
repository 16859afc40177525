package com.ospicorp.fewsjdbc.filter.model;

/**
 * Reusable reference to the parameters of a leaf filter. Presentation code turns it into
 * whatever link format it needs.
 */
public record ParameterLookupKey(String sourceSlug, String filterId) {}
