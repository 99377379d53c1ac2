package com.id.spectra.modules.visits.logic;

import com.id.spectra.modules.visits.model.Visit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a sorted time axis into visits wherever consecutive samples are further apart than a
 * threshold. Returned ranges are half-open and cover the whole axis.
 */
@Slf4j
public final class VisitSegmenter {

    private VisitSegmenter() {
    }

    /**
     * @param timeHours      - ascending time axis (hours)
     * @param gapThreshold   - largest gap (hours) still inside one visit
     * @return visits in time order, empty for an empty axis
     */
    public static List<Visit> segment(double[] timeHours, double gapThreshold) {
        List<Visit> visits = new ArrayList<>();
        if (timeHours.length == 0) {
            return visits;
        }
        int start = 0;
        for (int i = 1; i < timeHours.length; i++) {
            if (timeHours[i] - timeHours[i - 1] > gapThreshold) {
                visits.add(new Visit(start, i));
                start = i;
            }
        }
        visits.add(new Visit(start, timeHours.length));

        log.info("Identified {} visits with gaps > {} hours", visits.size(), gapThreshold);
        if (log.isDebugEnabled()) {
            for (int v = 0; v < visits.size(); v++) {
                Visit visit = visits.get(v);
                log.debug("Visit {}: {} integrations, {} to {} hours", v + 1, visit.length(),
                        timeHours[visit.start()], timeHours[visit.end() - 1]);
            }
        }
        return visits;
    }

    /**
     * Segmentation used for display: a series already interpolated onto a uniform time grid is a
     * single visit.
     */
    public static List<Visit> segment(double[] timeHours, double gapThreshold, boolean interpolated) {
        if (interpolated && timeHours.length > 0) {
            return List.of(new Visit(0, timeHours.length));
        }
        return segment(timeHours, gapThreshold);
    }
}
