package com.chatmirror;

public class Const {
    public static class Config {
        public static final String VERTX_CONFIG_PATH_PROP = "vertx-config-path";
        public static final String LOCAL_CONFIG_PATH = "conf/local-config.json";

        public static final String ServiceVerboseProp = "service_verbose";
        public static final String ServicePortProp = "service_port";
        public static final String StorageMockProp = "storage_mock";
        public static final String InternalApiTokenProp = "chat_mirror_internal_api_token";

        public static final String RedisConnectionStringProp = "redis_connection_string";
        public static final String RedisMaxPoolSizeProp = "redis_max_pool_size";
        public static final String RedisMaxPoolWaitingProp = "redis_max_pool_waiting";
        public static final String StoreTimeoutMsProp = "store_timeout_ms";
        public static final String StoreRetryCountProp = "store_retry_count";
        public static final String StoreRetryBackoffMsProp = "store_retry_backoff_ms";
        public static final String StoreMaxRetryBackoffMsProp = "store_max_retry_backoff_ms";

        public static final String SqsEndpointOverrideProp = "sqs_endpoint_override";
        public static final String SqsRegionProp = "sqs_region";
        public static final String PullMaxMessagesProp = "pull_max_messages";
        public static final String PullWaitTimeSecondsProp = "pull_wait_time_seconds";
        public static final String PullVisibilityTimeoutProp = "pull_visibility_timeout_seconds";
        public static final String PullStopTimeoutMsProp = "pull_stop_timeout_ms";

        public static final String BackfillBufferPagesProp = "backfill_buffer_pages";

        public static final String MicrosoftGraphBaseUrlProp = "microsoft_graph_base_url";
        public static final String MicrosoftGraphTokenProp = "microsoft_graph_token";
        public static final String MicrosoftUpdateAfterDeleteProp = "microsoft_update_after_delete";
        public static final String GoogleChatBaseUrlProp = "google_chat_base_url";
        public static final String GoogleDirectoryBaseUrlProp = "google_directory_base_url";
        public static final String GoogleDirectoryCustomerProp = "google_directory_customer";
        public static final String GoogleTokenProp = "google_token";
        public static final String GoogleUpdateAfterDeleteProp = "google_update_after_delete";

        public static final String PlatformHttpRetryCountProp = "platform_http_retry_count";
        public static final String PlatformHttpRetryBackoffMsProp = "platform_http_retry_backoff_ms";
        public static final String PlatformHttpTimeoutMsProp = "platform_http_timeout_ms";
    }

    public static class Port {
        public static final int ServicePort = 8090;
        public static final int PrometheusPort = 9090;
    }

    public static class Pull {
        public static final int DefaultMaxMessages = 10;
        public static final int DefaultWaitTimeSeconds = 2;
        public static final int DefaultVisibilityTimeoutSeconds = 30;
        public static final long DefaultStopTimeoutMs = 3000;
    }

    public static class Backfill {
        public static final int DefaultBufferPages = 10;
    }
}
