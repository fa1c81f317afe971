package com.enterprise.clickhouse.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code clickhouse.query.*} settings shared by the runner and the batch readers.
 */
@ConfigurationProperties(prefix = "clickhouse.query")
public class ClickHouseQueryProperties {

    /** Rows fetched per round trip. */
    private int fetchSize = 1000;

    /** Statement timeout in seconds, 0 for none. */
    private int queryTimeoutSeconds = 0;

    public int getFetchSize() {
        return fetchSize;
    }

    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }
}
