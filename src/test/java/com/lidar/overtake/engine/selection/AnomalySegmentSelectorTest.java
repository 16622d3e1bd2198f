package com.lidar.overtake.engine.selection;

import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.Sample;
import com.lidar.overtake.model.SegmentSelection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalySegmentSelectorTest {

    private final AnomalySegmentSelector selector = new AnomalySegmentSelector();

    /** One sample per value, timestamps 0.02s apart. */
    private static List<Sample> samplesOf(int... values) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(new Sample(i, i * 0.02, values[i]));
        }
        return samples;
    }

    private static Set<Integer> range(int fromInclusive, int toExclusive) {
        Set<Integer> set = new TreeSet<>();
        for (int i = fromInclusive; i < toExclusive; i++) {
            set.add(i);
        }
        return set;
    }

    private static int[] repeat(int value, int count, int... tail) {
        int[] values = new int[count + tail.length];
        for (int i = 0; i < count; i++) {
            values[i] = value;
        }
        System.arraycopy(tail, 0, values, count, tail.length);
        return values;
    }

    @Test
    void select_smallLowCommunityBeatsLargeHighOne() {
        int[] values = new int[60];
        for (int i = 0; i < 10; i++) values[i] = 480;
        for (int i = 10; i < 60; i++) values[i] = 700;
        List<Sample> samples = samplesOf(values);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 10), range(10, 60)), 520, 0.08);

        assertThat(selection.isFound()).isTrue();
        assertThat(selection.getSegment().getCommunityIndex()).isEqualTo(0);
        assertThat(selection.getSegment().getValues()).hasSize(10).containsOnly(480);
        assertThat(selection.getSegment().getMeanValue()).isEqualTo(480.0);
    }

    @Test
    void select_partitionOrderDoesNotHideTheCandidate() {
        int[] values = new int[60];
        for (int i = 0; i < 50; i++) values[i] = 700;
        for (int i = 50; i < 60; i++) values[i] = 480;
        List<Sample> samples = samplesOf(values);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 50), range(50, 60)), 520, 0.08);

        assertThat(selection.isFound()).isTrue();
        assertThat(selection.getSegment().getCommunityIndex()).isEqualTo(1);
        assertThat(selection.getSegment().getMembers()).containsExactlyElementsOf(range(50, 60));
    }

    @Test
    void select_largestCandidateWins() {
        List<Sample> samples = samplesOf(repeat(400, 3, 450, 450, 450, 450, 450));

        SegmentSelection selection = selector.select(samples, List.of(range(0, 3), range(3, 8)), 520, 0.08);

        assertThat(selection.getSegment().getCommunityIndex()).isEqualTo(1);
        assertThat(selection.getSegment().getValues()).containsOnly(450);
    }

    @Test
    void select_sizeTie_firstInPartitionOrderWins() {
        List<Sample> samples = samplesOf(300, 300, 450, 450);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 2), range(2, 4)), 520, 0.08);

        assertThat(selection.getSegment().getCommunityIndex()).isEqualTo(0);
        assertThat(selection.getSegment().getValues()).containsExactly(300, 300);
    }

    @Test
    void select_noCommunityBelowThreshold_notFound() {
        List<Sample> samples = samplesOf(700, 710, 800, 810);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 2), range(2, 4)), 520, 0.08);

        assertThat(selection.isFound()).isFalse();
        assertThat(selection.getSegment()).isNull();
        assertThat(selection.getReason()).contains("low-distance threshold");
    }

    @Test
    void select_meanEqualToThreshold_notACandidate() {
        List<Sample> samples = samplesOf(520, 520);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 2)), 520, 0.08);

        assertThat(selection.isFound()).isFalse();
    }

    @Test
    void select_emptyPartition_notFound() {
        SegmentSelection selection = selector.select(Collections.emptyList(), Collections.emptyList(), 520, 0.08);

        assertThat(selection.isFound()).isFalse();
        assertThat(selection.getReason()).isEqualTo("No communities to select from");
    }

    @Test
    void select_medianFilter_dropsOutlier() {
        List<Sample> samples = samplesOf(400, 410, 420, 430, 600);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 5)), 520, 0.08);

        // median 420, band 33.6
        assertThat(selection.getSegment().getMedianValue()).isEqualTo(420.0);
        assertThat(selection.getSegment().getValues()).containsExactly(400, 410, 420, 430);
        assertThat(selection.getSegment().getTimestamps()).containsExactly(
                samples.get(0).getTimestamp(), samples.get(1).getTimestamp(),
                samples.get(2).getTimestamp(), samples.get(3).getTimestamp());
        assertThat(selection.getSegment().getMembers()).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void select_bandEdgeIsExclusive() {
        // median 100, band exactly 50: 50 and 150 sit on the edge
        List<Sample> samples = samplesOf(50, 100, 100, 150, 100);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 5)), 520, 0.5);

        assertThat(selection.getSegment().getValues()).containsExactly(100, 100, 100);
    }

    @Test
    void select_outputFollowsAscendingIndexOrder() {
        List<Sample> samples = samplesOf(420, 800, 410, 800, 430);

        SegmentSelection selection = selector.select(samples,
                List.of(new TreeSet<>(Set.of(4, 0, 2)), new TreeSet<>(Set.of(1, 3))), 520, 0.08);

        assertThat(selection.getSegment().getMembers()).containsExactly(0, 2, 4);
        assertThat(selection.getSegment().getValues()).containsExactly(420, 410, 430);
    }

    @Test
    void select_zeroMedian_foundButEmpty() {
        List<Sample> samples = samplesOf(0, 0, 0);

        SegmentSelection selection = selector.select(samples, List.of(range(0, 3)), 520, 0.08);

        assertThat(selection.isFound()).isTrue();
        assertThat(selection.getSegment().getMedianValue()).isEqualTo(0.0);
        assertThat(selection.getSegment().getValues()).isEmpty();
        assertThat(selection.getSegment().getTimestamps()).isEmpty();
    }

    @Test
    void select_withParameters_usesConfiguredThresholds() {
        List<Sample> samples = samplesOf(600, 600, 900, 900);
        DetectionParameters params = DetectionParameters.defaults().toBuilder()
                .lowDistanceThreshold(650)
                .build();

        SegmentSelection selection = selector.select(samples, List.of(range(0, 2), range(2, 4)), params);

        assertThat(selection.isFound()).isTrue();
        assertThat(selection.getSegment().getValues()).containsExactly(600, 600);
    }

    @Test
    void median_oddAndEvenCounts() {
        assertThat(AnomalySegmentSelector.median(new int[]{5, 1, 3})).isEqualTo(3.0);
        assertThat(AnomalySegmentSelector.median(new int[]{100, 106, 101, 105})).isEqualTo(103.0);
        assertThat(AnomalySegmentSelector.median(new int[]{7})).isEqualTo(7.0);
    }
}
