package com.regwatch.collectors.api;

public enum FetchFailure {
    TIMEOUT,
    NETWORK,
    HTTP_STATUS
}
