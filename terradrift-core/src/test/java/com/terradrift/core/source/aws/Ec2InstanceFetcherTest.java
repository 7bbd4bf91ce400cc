package com.terradrift.core.source.aws;

import com.terradrift.core.error.FetchException;
import com.terradrift.core.metrics.DriftMetrics;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.ConfigValue.MapValue;
import com.terradrift.core.normalize.ConfigNormalizer;
import com.terradrift.core.source.RetryPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesResponse;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.EbsInstanceBlockDevice;
import software.amazon.awssdk.services.ec2.model.GroupIdentifier;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceBlockDeviceMapping;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.Volume;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link Ec2InstanceFetcher} against a mocked {@link Ec2Client}.
 */
@ExtendWith(MockitoExtension.class)
class Ec2InstanceFetcherTest {

    private static final RetryPolicy FAST_RETRY =
        new RetryPolicy(Duration.ofMillis(30), Duration.ofMillis(10), 1.0);

    @Mock
    private Ec2Client ec2;

    private SimpleMeterRegistry registry;
    private Ec2InstanceFetcher fetcher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        fetcher = new Ec2InstanceFetcher(ec2, FAST_RETRY, new DriftMetrics(registry));
    }

    @Test
    void fetch_describedInstance_mapsTerraformAttributeNames() {
        // Given
        when(ec2.describeInstances(any(DescribeInstancesRequest.class))).thenReturn(responseWith(webInstance()));
        when(ec2.describeVolumes(any(DescribeVolumesRequest.class))).thenAnswer(invocation -> {
            DescribeVolumesRequest request = invocation.getArgument(0);
            String volumeId = request.volumeIds().get(0);
            return DescribeVolumesResponse.builder()
                .volumes(Volume.builder()
                    .volumeId(volumeId)
                    .size("vol-root".equals(volumeId) ? 8 : 100)
                    .volumeType("gp3")
                    .encrypted(true)
                    .iops(3000)
                    .build())
                .build();
        });

        // When
        MapValue live = (MapValue) fetcher.fetch("i-0abc");

        // Then
        assertThat(live.get("instance_type")).contains(ConfigValue.of("t2.micro"));
        assertThat(live.get("ami")).contains(ConfigValue.of("ami-123"));
        assertThat(live.get("subnet_id")).contains(ConfigValue.of("subnet-1"));
        assertThat(live.get("associate_public_ip_address")).contains(ConfigValue.of(true));
        assertThat(live.get("vpc_security_group_ids"))
            .contains(ConfigValue.list(ConfigValue.of("sg-1"), ConfigValue.of("sg-2")));
        assertThat(live.get("tags"))
            .contains(ConfigNormalizer.normalize(Map.of("Name", "web")));
        assertThat(live.get("root_block_device")).contains(ConfigNormalizer.normalize(List.of(Map.of(
            "device_name", "/dev/xvda",
            "volume_id", "vol-root",
            "delete_on_termination", true,
            "volume_size", 8,
            "volume_type", "gp3",
            "encrypted", true,
            "iops", 3000))));
        assertThat(((ConfigValue.ListValue) live.get("ebs_block_device").orElseThrow()).size()).isEqualTo(1);
    }

    @Test
    void fetch_volumeLookupFails_keepsDeviceWithoutDetail() {
        // Given
        when(ec2.describeInstances(any(DescribeInstancesRequest.class))).thenReturn(responseWith(webInstance()));
        when(ec2.describeVolumes(any(DescribeVolumesRequest.class)))
            .thenThrow(SdkClientException.create("connection reset"));

        // When
        MapValue live = (MapValue) fetcher.fetch("i-0abc");

        // Then
        assertThat(live.get("root_block_device")).contains(ConfigNormalizer.normalize(List.of(Map.of(
            "device_name", "/dev/xvda",
            "volume_id", "vol-root",
            "delete_on_termination", true))));
        assertThat(errorCount("DescribeVolumes")).isEqualTo(2.0);
    }

    @Test
    void fetch_noReservations_throwsNotFound() {
        when(ec2.describeInstances(any(DescribeInstancesRequest.class)))
            .thenReturn(DescribeInstancesResponse.builder().build());

        assertThatThrownBy(() -> fetcher.fetch("i-missing"))
            .isInstanceOf(FetchException.class)
            .hasMessageContaining("i-missing not found");
    }

    @Test
    void fetch_transientFailureThenSuccess_retries() {
        // Given
        Instance bare = Instance.builder().instanceId("i-0abc").instanceType("t3.small").build();
        when(ec2.describeInstances(any(DescribeInstancesRequest.class)))
            .thenThrow(serviceError(503, "ServiceUnavailable"))
            .thenReturn(responseWith(bare));

        // When
        MapValue live = (MapValue) fetcher.fetch("i-0abc");

        // Then
        assertThat(live.get("instance_type")).contains(ConfigValue.of("t3.small"));
        verify(ec2, times(2)).describeInstances(any(DescribeInstancesRequest.class));
        assertThat(successCount("DescribeInstances")).isEqualTo(1.0);
    }

    @Test
    void fetch_transientFailureEveryTime_givesUpAfterBudget() {
        // Given
        when(ec2.describeInstances(any(DescribeInstancesRequest.class)))
            .thenThrow(serviceError(500, "InternalError"));

        // When / Then
        assertThatThrownBy(() -> fetcher.fetch("i-0abc"))
            .isInstanceOf(FetchException.class)
            .hasMessageContaining("Error describing instance i-0abc");
        verify(ec2, times(FAST_RETRY.maxAttempts())).describeInstances(any(DescribeInstancesRequest.class));
        assertThat(errorCount("DescribeInstances")).isEqualTo(1.0);
    }

    @Test
    void fetch_clientError_failsWithoutRetry() {
        // Given
        when(ec2.describeInstances(any(DescribeInstancesRequest.class)))
            .thenThrow(serviceError(400, "InvalidInstanceID.NotFound"));

        // When / Then
        assertThatThrownBy(() -> fetcher.fetch("i-0abc"))
            .isInstanceOf(FetchException.class)
            .satisfies(e -> assertThat(((FetchException) e).getResourceId()).isEqualTo("i-0abc"));
        verify(ec2, times(1)).describeInstances(any(DescribeInstancesRequest.class));
        verify(ec2, never()).describeVolumes(any(DescribeVolumesRequest.class));
    }

    @Test
    void isTransient_classifiesFailures() {
        assertThat(Ec2InstanceFetcher.isTransient(serviceError(500, "InternalError"))).isTrue();
        assertThat(Ec2InstanceFetcher.isTransient(serviceError(429, "TooManyRequests"))).isTrue();
        assertThat(Ec2InstanceFetcher.isTransient(serviceError(400, "RequestLimitExceeded"))).isTrue();
        assertThat(Ec2InstanceFetcher.isTransient(SdkClientException.create("timeout"))).isTrue();
        assertThat(Ec2InstanceFetcher.isTransient(serviceError(400, "InvalidInstanceID.NotFound"))).isFalse();
        assertThat(Ec2InstanceFetcher.isTransient(AbortedException.create("interrupted"))).isFalse();
        assertThat(Ec2InstanceFetcher.isTransient(new IllegalStateException())).isFalse();
    }

    private double successCount(String api) {
        return apiCalls(api, "success");
    }

    private double errorCount(String api) {
        return apiCalls(api, "error");
    }

    private double apiCalls(String api, String status) {
        Counter counter = registry.find(DriftMetrics.AWS_API_CALLS)
            .tag("api", api)
            .tag("status", status)
            .counter();
        return counter == null ? 0.0 : counter.count();
    }

    private static Instance webInstance() {
        return Instance.builder()
            .instanceId("i-0abc")
            .instanceType("t2.micro")
            .imageId("ami-123")
            .subnetId("subnet-1")
            .publicIpAddress("203.0.113.10")
            .securityGroups(
                GroupIdentifier.builder().groupId("sg-1").build(),
                GroupIdentifier.builder().groupId("sg-2").build())
            .tags(Tag.builder().key("Name").value("web").build())
            .rootDeviceName("/dev/xvda")
            .blockDeviceMappings(
                InstanceBlockDeviceMapping.builder()
                    .deviceName("/dev/xvda")
                    .ebs(EbsInstanceBlockDevice.builder().volumeId("vol-root").deleteOnTermination(true).build())
                    .build(),
                InstanceBlockDeviceMapping.builder()
                    .deviceName("/dev/sdf")
                    .ebs(EbsInstanceBlockDevice.builder().volumeId("vol-data").deleteOnTermination(false).build())
                    .build())
            .build();
    }

    private static DescribeInstancesResponse responseWith(Instance instance) {
        return DescribeInstancesResponse.builder()
            .reservations(Reservation.builder().instances(instance).build())
            .build();
    }

    private static Ec2Exception serviceError(int status, String code) {
        return (Ec2Exception) Ec2Exception.builder()
            .statusCode(status)
            .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
            .build();
    }
}
