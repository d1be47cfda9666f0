package com.workoutapi.refresh.service;

import com.oracle.bmc.auth.InstancePrincipalsAuthenticationDetailsProvider;
import com.oracle.bmc.monitoring.MonitoringClient;
import com.oracle.bmc.monitoring.model.Datapoint;
import com.oracle.bmc.monitoring.model.MetricDataDetails;
import com.oracle.bmc.monitoring.model.PostMetricDataDetails;
import com.oracle.bmc.monitoring.requests.PostMetricDataRequest;
import com.workoutapi.refresh.model.RunSummary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Exports refresh run metrics to OCI Monitoring. Every call is a no-op while
 * {@code oci.monitoring.enabled} is false or the client could not be built.
 */
@Service
@Slf4j
public class OciMonitoringService implements MonitoringService {

    private static final String TELEMETRY_INGESTION_ENDPOINT = "https://telemetry-ingestion.%s.oraclecloud.com";

    private MonitoringClient monitoringClient;

    @Value("${oci.monitoring.compartment-id:}")
    private String compartmentId;

    @Value("${oci.monitoring.namespace:ExerciseRefresh}")
    private String namespace;

    @Value("${oci.monitoring.enabled:false}")
    private boolean enabled;

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("📉 OCI Monitoring disabled, refresh metrics stay local");
            return;
        }
        try {
            monitoringClient = createClient();
        } catch (Exception e) {
            log.error("❌ OCI Monitoring client unavailable, refresh metrics will not be exported", e);
            enabled = false;
        }
    }

    private MonitoringClient createClient() {
        InstancePrincipalsAuthenticationDetailsProvider provider = InstancePrincipalsAuthenticationDetailsProvider
                .builder().build();
        MonitoringClient client = MonitoringClient.builder().build(provider);
        // Metric ingestion has its own endpoint, separate from the query API
        String endpoint = String.format(TELEMETRY_INGESTION_ENDPOINT, provider.getRegion().getRegionId());
        client.setEndpoint(endpoint);
        log.info("📈 OCI Monitoring exporting to {} (namespace {})", endpoint, sanitizeNamespace(namespace));
        return client;
    }

    @Override
    public void recordRunDuration(long durationMs, String status) {
        if (!enabled) {
            return;
        }
        publish(List.of(metric("RefreshRunDuration", durationMs, "milliseconds", Map.of("status", status))));
    }

    @Override
    public void recordOutcomes(RunSummary summary) {
        if (!enabled) {
            return;
        }
        publish(List.of(
                metric("ExercisesRefreshed", summary.getProcessed(), "count", Map.of("outcome", "processed")),
                metric("ExercisesSkipped", summary.getSkipped(), "count", Map.of("outcome", "skipped")),
                metric("ExercisesFailed", summary.getFailed(), "count", Map.of("outcome", "failed"))));
    }

    private MetricDataDetails metric(String name, double value, String unit, Map<String, String> dimensions) {
        return MetricDataDetails.builder()
                .namespace(sanitizeNamespace(namespace))
                .compartmentId(compartmentId)
                .name(name)
                .metadata(Collections.singletonMap("unit", unit))
                .dimensions(dimensions)
                .datapoints(List.of(Datapoint.builder()
                        .timestamp(new Date())
                        .value(value)
                        .count(1)
                        .build()))
                .build();
    }

    // One request per run event; a failed export never affects the run
    private void publish(List<MetricDataDetails> metrics) {
        PostMetricDataRequest request = PostMetricDataRequest.builder()
                .postMetricDataDetails(PostMetricDataDetails.builder().metricData(metrics).build())
                .build();
        try {
            monitoringClient.postMetricData(request);
            log.debug("Exported {} refresh metric(s) to OCI", metrics.size());
        } catch (Exception e) {
            log.warn("⚠️ Could not export {} refresh metric(s) to OCI: {}", metrics.size(), e.getMessage());
        }
    }

    /**
     * OCI namespaces must match {@code ^[a-z][a-z0-9_]*[a-z0-9]$}.
     */
    static String sanitizeNamespace(String raw) {
        String sanitized = raw.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        if (!sanitized.isEmpty() && !Character.isLetter(sanitized.charAt(0))) {
            sanitized = "n_" + sanitized;
        }
        return sanitized;
    }

    @PreDestroy
    public void close() {
        if (monitoringClient != null) {
            monitoringClient.close();
        }
    }
}
