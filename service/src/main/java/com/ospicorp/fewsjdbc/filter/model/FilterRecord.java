package com.ospicorp.fewsjdbc.filter.model;

/**
 * One flat row of the filter hierarchy. {@code parentId} is {@code null} for the roots of a
 * custom filter definition; remote filters use a sentinel id instead.
 */
public record FilterRecord(String id, String name, String parentId) {}
