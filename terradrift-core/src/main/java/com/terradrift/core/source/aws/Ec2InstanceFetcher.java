package com.terradrift.core.source.aws;

import com.terradrift.core.error.FetchException;
import com.terradrift.core.metrics.DriftMetrics;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.normalize.ConfigNormalizer;
import com.terradrift.core.source.LiveResourceFetcher;
import com.terradrift.core.source.RetryPolicy;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.Ec2ClientBuilder;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesResponse;
import software.amazon.awssdk.services.ec2.model.EbsInstanceBlockDevice;
import software.amazon.awssdk.services.ec2.model.GroupIdentifier;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceBlockDeviceMapping;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.Volume;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetches EC2 instance configuration through the AWS SDK.
 *
 * <p>The instance description is mapped onto the attribute names Terraform uses for
 * {@code aws_instance}, so both trees can be compared key by key:
 * <ul>
 *   <li>{@code instance_type}, {@code ami}, {@code subnet_id}</li>
 *   <li>{@code associate_public_ip_address} - whether the instance has a public IP</li>
 *   <li>{@code vpc_security_group_ids} - list of group IDs</li>
 *   <li>{@code tags} - map of tag key to value</li>
 *   <li>{@code root_block_device} - the EBS device mounted at the root device name</li>
 *   <li>{@code ebs_block_device} - every other EBS device</li>
 * </ul>
 *
 * <p>{@code DescribeInstances} is retried under the configured {@link RetryPolicy}. Each block
 * device is enriched with {@code DescribeVolumes} detail; if that lookup fails the device is
 * kept without it and a warning is logged.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (Ec2Client ec2 = Ec2InstanceFetcher.createClient("eu-west-1")) {
 *     LiveResourceFetcher fetcher = new Ec2InstanceFetcher(ec2, RetryPolicy.defaults(), metrics);
 *     ConfigValue live = fetcher.fetch("i-0123456789abcdef0");
 * }
 * }</pre>
 */
public class Ec2InstanceFetcher implements LiveResourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(Ec2InstanceFetcher.class);

    private static final String DESCRIBE_INSTANCES = "DescribeInstances";
    private static final String DESCRIBE_VOLUMES = "DescribeVolumes";
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_SERVER_ERROR = 500;

    private final Ec2Client ec2Client;
    private final RetryPolicy retryPolicy;
    private final DriftMetrics metrics;

    public Ec2InstanceFetcher(Ec2Client ec2Client, RetryPolicy retryPolicy, DriftMetrics metrics) {
        this.ec2Client = Objects.requireNonNull(ec2Client, "ec2Client must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Creates an EC2 client using the SDK's default credential chain.
     *
     * @param region region name, or null/blank to use the SDK's default region resolution
     * @return EC2 client, to be closed by the caller
     */
    public static Ec2Client createClient(String region) {
        Ec2ClientBuilder builder = Ec2Client.builder();
        if (region != null && !region.isBlank()) {
            builder.region(Region.of(region));
        }
        return builder.build();
    }

    @Override
    public ConfigValue fetch(String resourceId) {
        Instance instance = describeInstance(resourceId);
        return ConfigNormalizer.normalize(mapInstance(instance));
    }

    private Instance describeInstance(String instanceId) {
        Retry retry = Retry.of(DESCRIBE_INSTANCES + "-" + instanceId,
            retryPolicy.toRetryConfig(Ec2InstanceFetcher::isTransient));
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} for {} (attempt {}, waiting {} ms): {}",
            DESCRIBE_INSTANCES, instanceId, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));

        DescribeInstancesRequest request = DescribeInstancesRequest.builder()
            .instanceIds(instanceId)
            .build();

        long start = System.nanoTime();
        DescribeInstancesResponse response;
        try {
            response = retry.executeSupplier(() -> ec2Client.describeInstances(request));
        } catch (SdkException e) {
            metrics.recordAwsApiCall(DESCRIBE_INSTANCES, false, Duration.ofNanos(System.nanoTime() - start));
            throw new FetchException(instanceId,
                "Error describing instance " + instanceId + ": " + e.getMessage(), e);
        }
        metrics.recordAwsApiCall(DESCRIBE_INSTANCES, true, Duration.ofNanos(System.nanoTime() - start));

        return response.reservations().stream()
            .map(Reservation::instances)
            .filter(instances -> !instances.isEmpty())
            .map(instances -> instances.get(0))
            .findFirst()
            .orElseThrow(() -> new FetchException(instanceId, "Instance " + instanceId + " not found"));
    }

    /**
     * Maps an instance description to plain Java values keyed by Terraform attribute names.
     *
     * @param instance described instance
     * @return attribute map
     */
    Map<String, Object> mapInstance(Instance instance) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("instance_type", instance.instanceTypeAsString());
        config.put("ami", instance.imageId());
        config.put("subnet_id", instance.subnetId());
        config.put("associate_public_ip_address", instance.publicIpAddress() != null);

        config.put("vpc_security_group_ids", instance.securityGroups().stream()
            .map(GroupIdentifier::groupId)
            .toList());

        Map<String, String> tags = new LinkedHashMap<>();
        for (Tag tag : instance.tags()) {
            tags.put(tag.key(), tag.value());
        }
        config.put("tags", tags);

        List<Map<String, Object>> rootDevices = new ArrayList<>();
        List<Map<String, Object>> ebsDevices = new ArrayList<>();
        for (InstanceBlockDeviceMapping mapping : instance.blockDeviceMappings()) {
            EbsInstanceBlockDevice ebs = mapping.ebs();
            if (ebs == null) {
                continue;
            }
            Map<String, Object> device = new LinkedHashMap<>();
            device.put("device_name", mapping.deviceName());
            device.put("volume_id", ebs.volumeId());
            device.put("delete_on_termination", Boolean.TRUE.equals(ebs.deleteOnTermination()));
            describeVolume(ebs.volumeId()).ifPresent(device::putAll);

            if (Objects.equals(mapping.deviceName(), instance.rootDeviceName())) {
                rootDevices.add(device);
            } else {
                ebsDevices.add(device);
            }
        }
        config.put("root_block_device", rootDevices);
        config.put("ebs_block_device", ebsDevices);
        return config;
    }

    /**
     * Looks up volume detail. Failure is not fatal: the caller keeps the device without it.
     */
    private Optional<Map<String, Object>> describeVolume(String volumeId) {
        if (volumeId == null) {
            return Optional.empty();
        }
        long start = System.nanoTime();
        try {
            DescribeVolumesResponse response = ec2Client.describeVolumes(DescribeVolumesRequest.builder()
                .volumeIds(volumeId)
                .build());
            metrics.recordAwsApiCall(DESCRIBE_VOLUMES, true, Duration.ofNanos(System.nanoTime() - start));

            if (response.volumes().isEmpty()) {
                log.warn("Failed to get volume information for {}: volume not found", volumeId);
                return Optional.empty();
            }
            Volume volume = response.volumes().get(0);
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("volume_size", volume.size());
            detail.put("volume_type", volume.volumeTypeAsString());
            detail.put("encrypted", volume.encrypted());
            if (volume.iops() != null) {
                detail.put("iops", volume.iops());
            }
            return Optional.of(detail);
        } catch (AbortedException e) {
            throw e;
        } catch (SdkException e) {
            metrics.recordAwsApiCall(DESCRIBE_VOLUMES, false, Duration.ofNanos(System.nanoTime() - start));
            log.warn("Failed to get volume information for {}: {}", volumeId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns true for failures worth retrying: network errors, throttling and 5xx responses.
     * Client errors such as {@code InvalidInstanceID.NotFound} fail immediately.
     */
    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof AbortedException) {
            return false;
        }
        if (throwable instanceof SdkServiceException service) {
            return service.isThrottlingException()
                || service.statusCode() == HTTP_TOO_MANY_REQUESTS
                || service.statusCode() >= HTTP_SERVER_ERROR;
        }
        return throwable instanceof SdkException;
    }
}
