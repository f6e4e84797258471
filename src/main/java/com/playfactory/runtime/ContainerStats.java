package com.playfactory.runtime;

public record ContainerStats(
    double cpuPercent,
    double memoryUsageMb,
    double memoryLimitMb,
    double networkRxMb,
    double networkTxMb
) {}
