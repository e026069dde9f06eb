package com.chatmirror;

import com.chatmirror.platform.DirectoryResolver;
import com.chatmirror.platform.PlatformBinding;
import com.chatmirror.platform.google.GoogleChatClient;
import com.chatmirror.platform.google.GoogleDirectoryResolver;
import com.chatmirror.platform.graph.GraphChatClient;
import com.chatmirror.platform.graph.GraphDirectoryResolver;
import com.chatmirror.projector.MessageProjector;
import com.chatmirror.projector.Platform;
import com.chatmirror.projector.UpdateAfterDeletePolicy;
import com.chatmirror.pull.PullStatusRepository;
import com.chatmirror.pull.PullerRegistry;
import com.chatmirror.pull.PullerSettings;
import com.chatmirror.store.InMemoryIndexStore;
import com.chatmirror.store.IndexStore;
import com.chatmirror.store.RedisIndexStore;
import com.chatmirror.vertx.ChatMirrorServiceVerticle;
import com.chatmirror.vertx.Endpoints;
import com.chatmirror.web.JsonHttpClient;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.prometheus.PrometheusRenameFilter;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.micrometer.Label;
import io.vertx.micrometer.MetricsDomain;
import io.vertx.micrometer.MicrometerMetricsOptions;
import io.vertx.micrometer.VertxPrometheusOptions;
import io.vertx.micrometer.backends.BackendRegistries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private final Vertx vertx;
    private final JsonObject config;
    private final IndexStore store;
    private final SqsClient sqsClient;
    private final PullerRegistry pullers;
    private final Map<Platform, PlatformBinding> bindings;

    public Main(Vertx vertx, JsonObject config) {
        this.vertx = vertx;
        this.config = config;

        boolean useStorageMock = config.getBoolean(Const.Config.StorageMockProp, false);
        if (useStorageMock) {
            this.store = new InMemoryIndexStore();
            LOGGER.warn("Using InMemoryIndexStore, mirrored messages are not persisted");
        } else {
            this.store = RedisIndexStore.create(vertx, config);
            LOGGER.info("Using RedisIndexStore");
        }

        this.sqsClient = createSqsClient(config);
        this.pullers = new PullerRegistry(sqsClient, new PullStatusRepository(store), PullerSettings.fromConfig(config));
        this.bindings = createBindings(config, store);
    }

    public static void main(String[] args) {
        final String vertxConfigPath = System.getProperty(Const.Config.VERTX_CONFIG_PATH_PROP);
        if (vertxConfigPath != null) {
            LOGGER.info("Running CUSTOM CONFIG mode, config: {}", vertxConfigPath);
        } else {
            LOGGER.info("Running LOCAL DEBUG mode, config: {}", Const.Config.LOCAL_CONFIG_PATH);
            System.setProperty(Const.Config.VERTX_CONFIG_PATH_PROP, Const.Config.LOCAL_CONFIG_PATH);
        }

        VertxPrometheusOptions prometheusOptions = new VertxPrometheusOptions()
            .setStartEmbeddedServer(true)
            .setEmbeddedServerOptions(new HttpServerOptions().setPort(prometheusPort()))
            .setEnabled(true);

        MicrometerMetricsOptions metricOptions = new MicrometerMetricsOptions()
            .setPrometheusOptions(prometheusOptions)
            .setLabels(EnumSet.of(Label.HTTP_METHOD, Label.HTTP_CODE, Label.HTTP_PATH))
            .setJvmMetricsEnabled(true)
            .setEnabled(true);
        setupMetrics(metricOptions);

        VertxOptions vertxOptions = new VertxOptions()
            .setMetricsOptions(metricOptions);

        Vertx vertx = Vertx.vertx(vertxOptions);

        ConfigRetriever retriever = createConfigRetriever(vertx);
        retriever.getConfig(ar -> {
            if (ar.failed()) {
                LOGGER.error("Unable to read config: " + ar.cause().getMessage(), ar.cause());
                return;
            }
            try {
                Main app = new Main(vertx, ar.result());
                app.run();
            } catch (Exception e) {
                LOGGER.error("Unable to create/run application: " + e.getMessage(), e);
                vertx.close();
                System.exit(1);
            }
        });
    }

    private static int prometheusPort() {
        String port = System.getenv("PROMETHEUS_PORT");
        return port == null ? Const.Port.PrometheusPort : Integer.parseInt(port);
    }

    // file config first, overridden by environment variables, then system properties
    static ConfigRetriever createConfigRetriever(Vertx vertx) {
        String configPath = System.getProperty(Const.Config.VERTX_CONFIG_PATH_PROP, Const.Config.LOCAL_CONFIG_PATH);
        ConfigStoreOptions fileStore = new ConfigStoreOptions()
            .setType("file")
            .setFormat("json")
            .setConfig(new JsonObject().put("path", configPath));
        ConfigStoreOptions envStore = new ConfigStoreOptions().setType("env");
        ConfigStoreOptions sysStore = new ConfigStoreOptions().setType("sys");
        ConfigRetrieverOptions options = new ConfigRetrieverOptions()
            .setScanPeriod(0)
            .addStore(fileStore)
            .addStore(envStore)
            .addStore(sysStore);
        return ConfigRetriever.create(vertx, options);
    }

    private static void setupMetrics(MicrometerMetricsOptions metricOptions) {
        BackendRegistries.setupBackend(metricOptions, null);

        if (BackendRegistries.getDefaultNow() instanceof PrometheusMeterRegistry) {
            PrometheusMeterRegistry prometheusRegistry = (PrometheusMeterRegistry) BackendRegistries.getDefaultNow();

            prometheusRegistry.config()
                // providing common renaming for prometheus metric, e.g. "hello.world" to "hello_world"
                .meterFilter(new PrometheusRenameFilter())
                .meterFilter(MeterFilter.replaceTagValues(Label.HTTP_PATH.toString(),
                    actualPath -> Endpoints.pathSet().contains(actualPath) ? actualPath : "unknown"))
                // Don't record metrics for 404s.
                .meterFilter(MeterFilter.deny(id ->
                    id.getName().startsWith(MetricsDomain.HTTP_SERVER.getPrefix()) &&
                    Objects.equals(id.getTag(Label.HTTP_CODE.toString()), "404")))
                .commonTags("application", "chat-mirror");

            // wire the prometheus registry to global static state used by the counters
            Metrics.addRegistry(prometheusRegistry);
        }
    }

    private static SqsClient createSqsClient(JsonObject config) {
        SqsClientBuilder builder = SqsClient.builder();
        String region = config.getString(Const.Config.SqsRegionProp);
        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region));
        }
        String endpointOverride = config.getString(Const.Config.SqsEndpointOverrideProp);
        if (endpointOverride != null && !endpointOverride.isBlank()) {
            LOGGER.info("Using SQS endpoint override: {}", endpointOverride);
            builder.endpointOverride(URI.create(endpointOverride));
        }
        return builder.build();
    }

    static Map<Platform, PlatformBinding> createBindings(JsonObject config, IndexStore store) {
        int retryCount = config.getInteger(Const.Config.PlatformHttpRetryCountProp, 3);
        long retryBackoffMs = config.getLong(Const.Config.PlatformHttpRetryBackoffMsProp, 1000L);
        Duration timeout = Duration.ofMillis(config.getLong(Const.Config.PlatformHttpTimeoutMsProp, 30000L));
        int bufferPages = config.getInteger(Const.Config.BackfillBufferPagesProp, Const.Backfill.DefaultBufferPages);

        Map<Platform, PlatformBinding> bindings = new EnumMap<>(Platform.class);

        String graphToken = config.getString(Const.Config.MicrosoftGraphTokenProp);
        if (graphToken != null && !graphToken.isBlank()) {
            JsonHttpClient http = new JsonHttpClient(graphToken, retryCount, retryBackoffMs, timeout);
            String baseUrl = config.getString(Const.Config.MicrosoftGraphBaseUrlProp, GraphChatClient.DEFAULT_BASE_URL);
            DirectoryResolver directory = new GraphDirectoryResolver(http, baseUrl);
            MessageProjector projector = new MessageProjector(Platform.MICROSOFT, store, directory,
                UpdateAfterDeletePolicy.fromConfig(config.getString(Const.Config.MicrosoftUpdateAfterDeleteProp),
                    Platform.MICROSOFT.defaultPolicy()));
            bindings.put(Platform.MICROSOFT, PlatformBinding.create(new GraphChatClient(http, baseUrl), directory, projector, bufferPages));
        } else {
            LOGGER.warn("{} not set, microsoft platform disabled", Const.Config.MicrosoftGraphTokenProp);
        }

        String googleToken = config.getString(Const.Config.GoogleTokenProp);
        if (googleToken != null && !googleToken.isBlank()) {
            JsonHttpClient http = new JsonHttpClient(googleToken, retryCount, retryBackoffMs, timeout);
            DirectoryResolver directory = new GoogleDirectoryResolver(http,
                config.getString(Const.Config.GoogleDirectoryBaseUrlProp, GoogleDirectoryResolver.DEFAULT_BASE_URL),
                config.getString(Const.Config.GoogleDirectoryCustomerProp, "my_customer"));
            MessageProjector projector = new MessageProjector(Platform.GOOGLE, store, directory,
                UpdateAfterDeletePolicy.fromConfig(config.getString(Const.Config.GoogleUpdateAfterDeleteProp),
                    Platform.GOOGLE.defaultPolicy()));
            GoogleChatClient client = new GoogleChatClient(http,
                config.getString(Const.Config.GoogleChatBaseUrlProp, GoogleChatClient.DEFAULT_BASE_URL));
            bindings.put(Platform.GOOGLE, PlatformBinding.create(client, directory, projector, bufferPages));
        } else {
            LOGGER.warn("{} not set, google platform disabled", Const.Config.GoogleTokenProp);
        }

        return bindings;
    }

    public void run() {
        this.createAppStatusMetric();
        this.createRunningPullersMetric();

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "chat-mirror-shutdown"));

        ChatMirrorServiceVerticle svc = new ChatMirrorServiceVerticle(config, pullers, bindings);
        this.deploy(svc)
            .onSuccess(id -> LOGGER.info("Chat mirror service fully started, platforms: {}", bindings.keySet()))
            .onFailure(t -> {
                LOGGER.error("Unable to bootstrap chat mirror service and its dependencies", t);
                vertx.close();
                System.exit(1);
            });
    }

    private void shutdown() {
        LOGGER.info("Shutting down, stopping pullers...");
        pullers.close();
        try {
            store.close();
        } catch (Exception e) {
            LOGGER.error("store_error: unable to close index store", e);
        }
        sqsClient.close();
    }

    private void createAppStatusMetric() {
        String version = Optional.ofNullable(System.getenv("IMAGE_VERSION")).orElse("unknown");
        Gauge.builder("app_status", () -> 1)
            .description("application version and status")
            .tag("version", version)
            .register(Metrics.globalRegistry);
    }

    private void createRunningPullersMetric() {
        Gauge.builder("chat_mirror_pullers", pullers, PullerRegistry::size)
            .description("gauge for number of subscription pullers created in this process")
            .register(Metrics.globalRegistry);
    }

    private Future<String> deploy(ChatMirrorServiceVerticle verticle) {
        Promise<String> promise = Promise.promise();
        vertx.deployVerticle(verticle, new DeploymentOptions(), ar -> promise.handle(ar));
        return promise.future();
    }
}
