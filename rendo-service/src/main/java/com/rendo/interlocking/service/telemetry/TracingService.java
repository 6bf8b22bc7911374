/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.service.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * OpenTelemetry bootstrap for the seeding run.
 *
 * <p>A seeding run is short and produces a handful of spans per station, so every trace
 * is sampled unless {@code OTEL_TRACE_SAMPLING_RATIO} says otherwise and pending spans are
 * drained on {@link #shutdown()}.
 *
 * Configuration via environment variables (or system properties of the same name):
 * - OTEL_DISABLED: Disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)
 * - SERVICE_NAME: Service identifier (default: rendo-seed)
 * - SERVICE_VERSION: Deployment version (default: unknown)
 * - DEPLOYMENT_ENVIRONMENT: prod|staging|dev (default: dev)
 */
public class TracingService {
    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);

    private static final String INSTRUMENTATION_NAME = "com.rendo.interlocking";
    private static final String DEFAULT_SERVICE_NAME = "rendo-seed";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer,
                           SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;

        if (!isNoop) {
            registerShutdownHook();
        }
    }

    /**
     * Get singleton instance with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    private static TracingService initialize() {
        try {
            if (isTracingDisabled()) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return createNoopInstance();
            }

            logger.info("Initializing OpenTelemetry tracing...");

            Sampler sampler = configureSampler();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(buildResource())
                    .setSampler(sampler)
                    .addSpanProcessor(
                            BatchSpanProcessor.builder(configureExporter())
                                    .setMaxQueueSize(2048)
                                    .setMaxExportBatchSize(256)
                                    .setScheduleDelay(Duration.ofSeconds(1))
                                    .setExporterTimeout(Duration.ofSeconds(30))
                                    .build()
                    )
                    .build();

            OpenTelemetrySdk openTelemetrySdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info("OpenTelemetry initialized: service={}, version={}, env={}, sampler={}",
                    getServiceName(), getServiceVersion(), getEnvironment(), sampler.getDescription());

            return new TracingService(openTelemetrySdk, openTelemetrySdk.getTracer(INSTRUMENTATION_NAME),
                    tracerProvider, false);

        } catch (RuntimeException e) {
            logger.error("Failed to initialize OpenTelemetry - falling back to noop", e);
            return createNoopInstance();
        }
    }

    private static TracingService createNoopInstance() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static Resource buildResource() {
        return Resource.getDefault().merge(
                Resource.create(
                        Attributes.builder()
                                .put(SERVICE_NAME, getServiceName())
                                .put(SERVICE_VERSION, getServiceVersion())
                                .put(DEPLOYMENT_ENVIRONMENT, getEnvironment())
                                .build()
                )
        );
    }

    private static Sampler configureSampler() {
        String samplingRatioStr = getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", "1.0");

        double samplingRatio;
        try {
            samplingRatio = Math.max(0.0, Math.min(1.0, Double.parseDouble(samplingRatioStr)));
        } catch (NumberFormatException e) {
            logger.warn("Invalid OTEL_TRACE_SAMPLING_RATIO '{}', sampling everything", samplingRatioStr);
            samplingRatio = 1.0;
        }

        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();

        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP exporter: {}", endpoint);
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            }
            case "logging" -> {
                logger.info("Using Logging exporter");
                yield LoggingSpanExporter.create();
            }
            default -> {
                logger.warn("Unknown exporter type: {}, using logging", exporterType);
                yield LoggingSpanExporter.create();
            }
        };
    }

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "otel-shutdown-hook"));
    }

    /**
     * Drain pending spans and stop the exporter. Safe to call more than once.
     */
    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }

        logger.debug("Draining span buffer...");
        tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
    }

    /**
     * Force flush all pending spans.
     */
    public void flush() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        tracerProvider.forceFlush().join(10, TimeUnit.SECONDS);
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static boolean isTracingDisabled() {
        return Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"));
    }

    private static String getServiceName() {
        return getEnvOrProperty("SERVICE_NAME", getEnvOrProperty("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME));
    }

    private static String getServiceVersion() {
        return getEnvOrProperty("SERVICE_VERSION", "unknown");
    }

    private static String getEnvironment() {
        return getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev");
    }

    /**
     * Get value from environment variable, falling back to system property.
     */
    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
