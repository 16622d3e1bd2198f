package com.lidar.overtake.engine;

import com.lidar.overtake.config.DetectionConfig;
import com.lidar.overtake.model.GraphStrategy;
import com.lidar.overtake.model.PartitionAlgorithm;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionParametersTest {

    @Test
    void defaults_matchDocumentedValues() {
        DetectionParameters params = DetectionParameters.defaults().validate();

        assertThat(params.getXgap()).isEqualTo(0.4);
        assertThat(params.getYgap()).isEqualTo(40.0);
        assertThat(params.getEpsilon()).isEqualTo(1.0);
        assertThat(params.getGraphStrategy()).isEqualTo(GraphStrategy.PROXIMITY);
        assertThat(params.isSymmetricEpsilonRule()).isFalse();
        assertThat(params.getAlgorithm()).isEqualTo(PartitionAlgorithm.LOUVAIN);
        assertThat(params.getResolution()).isEqualTo(1.0);
        assertThat(params.getGainThreshold()).isEqualTo(1e-7);
        assertThat(params.getLowDistanceThreshold()).isEqualTo(520.0);
        assertThat(params.getOutlierTolerance()).isEqualTo(0.08);
    }

    @Test
    void from_copiesConfig() {
        DetectionConfig config = new DetectionConfig();
        config.setXgap(0.8);
        config.setGraphStrategy(GraphStrategy.WEIGHTED);

        DetectionParameters params = DetectionParameters.from(config);

        assertThat(params.getXgap()).isEqualTo(0.8);
        assertThat(params.getGraphStrategy()).isEqualTo(GraphStrategy.WEIGHTED);
    }

    @Test
    void validate_zeroGapsAreAllowed() {
        DetectionParameters params = DetectionParameters.defaults().toBuilder()
                .xgap(0.0).ygap(0.0).epsilon(0.0).outlierTolerance(0.0)
                .build();

        assertThat(params.validate()).isSameAs(params);
    }

    @Test
    void validate_negativeXgap_namesField() {
        DetectionParameters params = DetectionParameters.defaults().toBuilder().xgap(-0.1).build();

        assertThatThrownBy(params::validate)
                .isInstanceOf(InvalidDetectionParametersException.class)
                .satisfies(e -> assertThat(((InvalidDetectionParametersException) e).getField()).isEqualTo("xgap"));
    }

    @Test
    void validate_nanYgap_namesField() {
        DetectionParameters params = DetectionParameters.defaults().toBuilder().ygap(Double.NaN).build();

        assertThatThrownBy(params::validate)
                .isInstanceOf(InvalidDetectionParametersException.class)
                .satisfies(e -> assertThat(((InvalidDetectionParametersException) e).getField()).isEqualTo("ygap"));
    }

    @Test
    void validate_infiniteTolerance_rejected() {
        DetectionParameters params = DetectionParameters.defaults().toBuilder()
                .outlierTolerance(Double.POSITIVE_INFINITY).build();

        assertThatThrownBy(params::validate)
                .isInstanceOf(InvalidDetectionParametersException.class)
                .hasMessageContaining("outlierTolerance");
    }

    @Test
    void validate_zeroResolution_rejected() {
        DetectionParameters params = DetectionParameters.defaults().toBuilder().resolution(0.0).build();

        assertThatThrownBy(params::validate)
                .isInstanceOf(InvalidDetectionParametersException.class)
                .satisfies(e -> assertThat(((InvalidDetectionParametersException) e).getField()).isEqualTo("resolution"));
    }

    @Test
    void validate_missingStrategy_rejected() {
        DetectionParameters params = DetectionParameters.defaults().toBuilder().graphStrategy(null).build();

        assertThatThrownBy(params::validate)
                .isInstanceOf(InvalidDetectionParametersException.class)
                .satisfies(e -> assertThat(((InvalidDetectionParametersException) e).getField()).isEqualTo("graphStrategy"));
    }
}
