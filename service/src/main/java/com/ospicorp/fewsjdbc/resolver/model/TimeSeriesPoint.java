package com.ospicorp.fewsjdbc.resolver.model;

import java.time.LocalDateTime;

public record TimeSeriesPoint(
    LocalDateTime timestamp,
    Double value,
    String flag,
    String detectionLimit,
    String comment) {}
