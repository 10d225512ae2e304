package com.cred.freestyle.enrollment.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * Metrics registry configuration.
 *
 * With enrollment.metrics.cloudwatch.enabled=true, metrics are published to
 * AWS CloudWatch under the configured namespace. Otherwise an in-memory
 * registry is used (local runs, tests).
 *
 * @author Enrollment Team
 */
@Configuration
public class CloudWatchConfig {

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:Enrollment}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step;

    @Bean
    @ConditionalOnProperty(name = "enrollment.metrics.cloudwatch.enabled", havingValue = "true")
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * CloudWatch registry. Keys follow micrometer's "cloudwatch." property prefix.
     */
    @Bean
    @ConditionalOnProperty(name = "enrollment.metrics.cloudwatch.enabled", havingValue = "true")
    public MeterRegistry cloudWatchMeterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> properties = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step
        );
        io.micrometer.cloudwatch2.CloudWatchConfig config = properties::get;

        return new CloudWatchMeterRegistry(config, Clock.SYSTEM, cloudWatchAsyncClient);
    }

    @Bean
    @ConditionalOnProperty(name = "enrollment.metrics.cloudwatch.enabled", havingValue = "false", matchIfMissing = true)
    public MeterRegistry simpleMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
