package com.sysmuse.leadership.model;

import com.sysmuse.leadership.config.PositionConfig;
import com.sysmuse.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares a parsed hierarchy against the required positions of its catalogue.
 */
public class CompletenessAnalyzer {

    public CompletenessReport analyze(LeadershipHierarchy hierarchy) {
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, PositionConfig> entry : hierarchy.getConfig().getRequiredPositions().entrySet()) {
            String path = entry.getKey();
            HierarchyPath parsed = HierarchyPath.parse(path);
            if (!hierarchy.isVacant(path) && !hierarchy.getPosition(parsed).isPresent()) {
                missing.add(path);
            }
        }

        List<String> incomplete = new ArrayList<>();
        int filled = 0;
        for (HierarchySection section : hierarchy.getSections().values()) {
            if (section.isList()) {
                continue;
            }
            for (Map.Entry<String, PersonInfo> seat : ((TreeSection) section).getSeats().entrySet()) {
                filled++;
                if (!seat.getValue().isComplete()) {
                    incomplete.add(section.getKey() + "." + seat.getKey());
                }
            }
        }

        CompletenessReport report = new CompletenessReport(missing,
                new ArrayList<>(hierarchy.getVacantPositions()), incomplete, filled);
        LoggingUtil.debug("Completeness: " + report);
        return report;
    }
}
