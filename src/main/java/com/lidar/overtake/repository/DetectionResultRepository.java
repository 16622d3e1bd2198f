package com.lidar.overtake.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lidar.overtake.config.AerospikeConfig;
import com.lidar.overtake.model.DetectionResult;
import com.lidar.overtake.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.Set;

@Repository
public class DetectionResultRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectionResultRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public DetectionResultRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                     @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(DetectionResult result) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RESULTS, result.getDetectionId());

        // Aerospike bin names are limited to 15 characters
        client.put(writePolicy, key,
                new Bin("detectionId", result.getDetectionId()),
                new Bin("sampleCount", result.getSampleCount()),
                new Bin("edgeCount", result.getEdgeCount()),
                new Bin("modularity", result.getModularity()),
                new Bin("degenerate", result.isPartitionDegenerate()),
                new Bin("segmentFound", result.isSegmentFound()),
                new Bin("reason", result.getReason()),
                new Bin("detectedAt", result.getDetectedAt()),
                new Bin("communities", toJson(result.getCommunities())),
                new Bin("segment", toJson(result.getSegment())));
    }

    public DetectionResult findById(String detectionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RESULTS, detectionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        List<Set<Integer>> communities = deserializeCommunities(record.getString("communities"));
        return DetectionResult.builder()
                .detectionId(detectionId)
                .sampleCount(record.getInt("sampleCount"))
                .edgeCount(record.getInt("edgeCount"))
                .communityCount(communities.size())
                .communities(communities)
                .modularity(record.getDouble("modularity"))
                .partitionDegenerate(record.getBoolean("degenerate"))
                .segmentFound(record.getBoolean("segmentFound"))
                .segment(deserializeSegment(record.getString("segment")))
                .reason(record.getString("reason"))
                .detectedAt(record.getLong("detectedAt"))
                .build();
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize {}", value.getClass().getSimpleName(), e);
            return null;
        }
    }

    private List<Set<Integer>> deserializeCommunities(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<Set<Integer>>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize communities", e);
            return Collections.emptyList();
        }
    }

    private Segment deserializeSegment(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, Segment.class);
        } catch (Exception e) {
            log.error("Failed to deserialize segment", e);
            return null;
        }
    }
}
