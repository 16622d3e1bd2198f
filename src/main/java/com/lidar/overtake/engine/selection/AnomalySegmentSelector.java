package com.lidar.overtake.engine.selection;

import com.lidar.overtake.engine.DetectionParameters;
import com.lidar.overtake.model.Sample;
import com.lidar.overtake.model.Segment;
import com.lidar.overtake.model.SegmentSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Picks the community that represents the overtake and strips its outliers.
 *
 * Logic: communities whose mean value is below the low-distance threshold are
 * candidates; the largest candidate wins (earliest in partition order on ties).
 * Members whose value deviates from the winner's median by less than
 * outlierTolerance * median form the segment.
 *
 * Example: threshold=520, communities with means 480 (10 members) and 700
 * (50 members). Only the first is a candidate, so it is selected despite its size.
 */
@Component
public class AnomalySegmentSelector {

    private static final Logger log = LoggerFactory.getLogger(AnomalySegmentSelector.class);

    public SegmentSelection select(List<Sample> samples, List<Set<Integer>> communities,
                                   DetectionParameters params) {
        return select(samples, communities, params.getLowDistanceThreshold(), params.getOutlierTolerance());
    }

    public SegmentSelection select(List<Sample> samples, List<Set<Integer>> communities,
                                   double lowDistanceThreshold, double outlierTolerance) {
        if (communities.isEmpty()) {
            return SegmentSelection.notFound("No communities to select from");
        }

        int selected = -1;
        int selectedSize = 0;
        double selectedMean = 0.0;
        for (int c = 0; c < communities.size(); c++) {
            Set<Integer> community = communities.get(c);
            double mean = mean(samples, community);
            if (mean < lowDistanceThreshold && community.size() > selectedSize) {
                selected = c;
                selectedSize = community.size();
                selectedMean = mean;
            }
        }

        if (selected < 0) {
            log.warn("No community has a mean value below {} ({} communities inspected)",
                    lowDistanceThreshold, communities.size());
            return SegmentSelection.notFound(String.format(
                    "No community mean below low-distance threshold %.1f", lowDistanceThreshold));
        }

        List<Integer> members = new ArrayList<>(communities.get(selected));
        members.sort(null);
        int[] memberValues = new int[members.size()];
        for (int k = 0; k < members.size(); k++) {
            memberValues[k] = samples.get(members.get(k)).getValue();
        }
        double median = median(memberValues);
        double band = outlierTolerance * median;

        List<Double> timestamps = new ArrayList<>();
        List<Integer> values = new ArrayList<>();
        for (int node : members) {
            Sample sample = samples.get(node);
            if (Math.abs(sample.getValue() - median) < band) {
                timestamps.add(sample.getTimestamp());
                values.add(sample.getValue());
            }
        }

        if (values.isEmpty()) {
            log.warn("Community {} selected but every member lies outside the median band (median={})",
                    selected, median);
        }

        Segment segment = Segment.builder()
                .communityIndex(selected)
                .members(members)
                .meanValue(selectedMean)
                .medianValue(median)
                .timestamps(timestamps)
                .values(values)
                .build();

        String reason = String.format(
                "Community %d selected: %d members, mean=%.1f below threshold %.1f, median=%.1f; "
                        + "%d of %d members within %.0f%% of the median",
                selected, members.size(), selectedMean, lowDistanceThreshold, median,
                values.size(), members.size(), outlierTolerance * 100.0);
        log.info(reason);
        return SegmentSelection.found(segment, reason);
    }

    private static double mean(List<Sample> samples, Set<Integer> community) {
        double sum = 0.0;
        for (int node : community) {
            sum += samples.get(node).getValue();
        }
        return sum / community.size();
    }

    static double median(int[] values) {
        int[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int n = sorted.length;
        return (n % 2 == 1)
                ? sorted[n / 2]
                : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }
}
