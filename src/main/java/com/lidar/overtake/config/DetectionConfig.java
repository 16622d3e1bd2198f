package com.lidar.overtake.config;

import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.PartitionAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Maximum time gap (seconds) for a direct edge. 20 lines at 50Hz.
    private double xgap = 0.4;

    // Maximum value gap (sensor units) for any edge.
    private double ygap = 40.0;

    // Fraction of xgap for the second-order closeness rule.
    private double epsilon = 1.0;

    private GraphStrategy graphStrategy = GraphStrategy.PROXIMITY;

    // Evaluate the second-order rule against first-order neighbors only (scan-order independent).
    private boolean symmetricEpsilonRule = false;

    // Exponent applied to inverse distances by the WEIGHTED strategy.
    private double weightExponent = 1.0;

    private PartitionAlgorithm algorithm = PartitionAlgorithm.LOUVAIN;

    // Louvain resolution (gamma). Values above 1 favour smaller communities.
    private double resolution = 1.0;

    // Minimum modularity improvement for another aggregation level.
    private double gainThreshold = 1e-7;

    // Communities whose mean distance is below this are overtake candidates.
    private double lowDistanceThreshold = 520.0;

    // Members deviating from the segment median by this fraction or more are dropped.
    private double outlierTolerance = 0.08;

    // Persist every detection result to Aerospike.
    private boolean persistResults = true;
}
