package com.ospicorp.fewsjdbc.resolver.model;

public record Location(String locationId, String location, Double longitude, Double latitude) {}
