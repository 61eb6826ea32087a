/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.aar.analysis.network;

import lombok.Value;
import org.fireflyframework.aar.analysis.AbstractAnalysisEngine;
import org.fireflyframework.aar.analysis.AnalysisFindings;
import org.fireflyframework.aar.analysis.Stats;
import org.fireflyframework.aar.analysis.ThresholdConfig;
import org.fireflyframework.aar.event.EventBus;
import org.fireflyframework.aar.model.Alert;
import org.fireflyframework.aar.model.AlertLevel;
import org.fireflyframework.aar.model.AnalysisDomain;
import org.fireflyframework.aar.model.DataQualityMetrics;
import org.fireflyframework.aar.model.TelemetryTable;
import org.fireflyframework.aar.model.Values;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import static java.util.Map.entry;
import static org.fireflyframework.aar.model.TelemetryColumns.CALLSIGN;
import static org.fireflyframework.aar.model.TelemetryColumns.IP;
import static org.fireflyframework.aar.model.TelemetryColumns.LATITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.LONGITUDE;
import static org.fireflyframework.aar.model.TelemetryColumns.MCS;
import static org.fireflyframework.aar.model.TelemetryColumns.NEXT_HOP;
import static org.fireflyframework.aar.model.TelemetryColumns.NEXT_HOP_UNAVAILABLE;
import static org.fireflyframework.aar.model.TelemetryColumns.RSSI;
import static org.fireflyframework.aar.model.TelemetryColumns.TIMESTAMP;

/**
 * Network performance analysis: signal strength tiers, modulation efficiency,
 * next-hop load and redundancy, communication blackouts, transmission quality and
 * geographic coverage.
 *
 * <p>RSSI and MCS readings below zero are sentinel values for "no reading" and are
 * excluded from the statistics.</p>
 */
public class NetworkPerformanceEngine extends AbstractAnalysisEngine {

    public static final String THRESHOLDS_KEY = "network_thresholds";

    public static final Map<String, Double> DEFAULT_THRESHOLDS = Map.ofEntries(
            entry("rssi_excellent", 30.0),
            entry("rssi_good", 20.0),
            entry("rssi_poor", 10.0),
            entry("rssi_critical", 5.0),
            entry("critical_signal_percentage_limit", 10.0),
            entry("poor_signal_percentage_limit", 10.0),
            entry("mcs_optimal_min", 5.0),
            entry("mcs_optimal_max", 7.0),
            entry("mcs_minimum", 3.0),
            entry("blackout_duration_warning", 30.0),
            entry("blackout_duration_critical", 60.0),
            entry("packet_loss_warning", 0.05),
            entry("packet_loss_critical", 0.15),
            entry("network_utilization_warning", 0.8),
            entry("network_utilization_critical", 0.95));

    /** Assumed reporting interval of a unit, used to estimate packet loss. */
    static final double REPORT_INTERVAL_SECONDS = 30.0;
    static final int COVERAGE_GRID_SIZE = 10;

    private static final List<String> NETWORK_COLUMNS = List.of(RSSI, MCS, NEXT_HOP, IP);

    public NetworkPerformanceEngine(EventBus eventBus) {
        super(AnalysisDomain.NETWORK_PERFORMANCE, THRESHOLDS_KEY, DEFAULT_THRESHOLDS, eventBus);
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(CALLSIGN, TIMESTAMP);
    }

    @Override
    public List<String> getOptionalColumns() {
        return List.of(RSSI, MCS, NEXT_HOP, IP, LATITUDE, LONGITUDE);
    }

    @Override
    public List<String> getAlertTypes() {
        return List.of("CRITICAL_SIGNAL_QUALITY", "POOR_SIGNAL_QUALITY", "UNITS_WITH_POOR_SIGNAL",
                "LOW_MCS_EFFICIENCY", "SUBOPTIMAL_MCS_EFFICIENCY", "UNITS_LOW_MCS_EFFICIENCY",
                "POOR_LOAD_DISTRIBUTION", "SINGLE_POINT_FAILURES", "CRITICAL_BLACKOUT_DURATION",
                "LONG_BLACKOUT_DURATION", "WIDESPREAD_BLACKOUTS", "CRITICAL_PACKET_LOSS", "HIGH_PACKET_LOSS",
                "POOR_TRANSMISSION_QUALITY", "POOR_NETWORK_COVERAGE", "COVERAGE_GAPS_DETECTED");
    }

    /**
     * Completeness is the mean availability of the network columns present in the
     * table; a table without any of them has no network data at all.
     */
    @Override
    public DataQualityMetrics validateData(TelemetryTable table) {
        DataQualityMetrics.DataQualityMetricsBuilder metrics = DataQualityMetrics.builder()
                .totalRecords(table.size());
        List<String> columns = Stream.concat(getRequiredColumns().stream(), getOptionalColumns().stream()).toList();
        Map<String, Double> missing = missingPercentages(table, columns, metrics);
        metrics.missingDataPercentage(missing);

        if (table.hasColumn(RSSI)) {
            List<Double> rssi = Stats.numbers(table, RSSI, value -> value >= 0);
            if (rssi.size() < table.size() * 0.5) {
                metrics.validationError("Less than 50% valid RSSI readings");
            }
            if (!rssi.isEmpty() && (Stats.max(rssi) > 100 || Stats.min(rssi) < -120)) {
                metrics.validationError("RSSI values outside reasonable range");
            }
        }
        if (table.hasColumn(MCS)) {
            List<Double> mcs = Stats.numbers(table, MCS, value -> value >= 0);
            if (!mcs.isEmpty() && Stats.max(mcs) > 11) {
                metrics.validationError("MCS values outside valid range (0-11)");
            }
        }

        List<Double> availability = NETWORK_COLUMNS.stream()
                .filter(table::hasColumn)
                .map(column -> 100.0 - missing.get(column))
                .toList();
        if (availability.isEmpty()) {
            metrics.dataCompleteness(0.0).validationError("No network performance data available");
        } else {
            metrics.dataCompleteness(Stats.mean(availability));
        }
        return metrics.build();
    }

    @Override
    protected void runAnalysis(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        Map<Object, List<Integer>> units = table.groupBy(CALLSIGN);
        findings.metric("total_units", units.size())
                .metric("data_timespan_hours", timespanSeconds(table) / 3600.0);

        List<Double> health = new ArrayList<>();
        Double criticalShare = null;
        Double mcsEfficiency = null;
        Double loadBalance = null;
        Double coverage = null;

        if (table.hasColumn(RSSI)) {
            criticalShare = analyzeSignal(table, units, thresholds, findings);
            if (criticalShare != null) {
                findings.metric("signal_quality_score", 100.0 - criticalShare);
                health.add(100.0 - criticalShare);
            }
        }
        if (table.hasColumn(MCS)) {
            mcsEfficiency = analyzeMcs(table, units, thresholds, findings);
            if (mcsEfficiency != null) {
                findings.metric("mcs_efficiency_score", mcsEfficiency);
                health.add(mcsEfficiency);
            }
        }
        if (table.hasColumn(NEXT_HOP)) {
            loadBalance = analyzeNextHops(table, units, findings);
        }

        BlackoutSummary blackouts = analyzeBlackouts(table, units, thresholds, findings);
        findings.metric("network_availability", blackouts.networkAvailability());
        health.add(blackouts.networkAvailability());

        if (table.hasColumn(RSSI) || table.hasColumn(MCS)) {
            analyzeTransmission(table, units.size(), thresholds, findings);
        }
        if (table.hasColumn(LATITUDE) && table.hasColumn(LONGITUDE) && table.hasColumn(RSSI)) {
            coverage = analyzeCoverage(table, thresholds, findings);
        }

        findings.metric("overall_network_health", Stats.mean(health));
        recommend(findings, criticalShare, mcsEfficiency, loadBalance, blackouts.getTotalBlackouts(), coverage);
    }

    // ---------------------------------------------------------------------
    // Signal strength
    // ---------------------------------------------------------------------

    /**
     * Classifies RSSI readings into tiers and raises signal alerts.
     *
     * @return the percentage of readings below {@code rssi_critical}, or {@code null}
     *         when there are no valid readings
     */
    private Double analyzeSignal(TelemetryTable table, Map<Object, List<Integer>> units,
                                 ThresholdConfig thresholds, AnalysisFindings findings) {
        List<Double> rssi = Stats.numbers(table, RSSI, value -> value >= 0);
        if (rssi.isEmpty()) {
            return null;
        }
        double excellent = thresholds.get("rssi_excellent");
        double good = thresholds.get("rssi_good");
        double poor = thresholds.get("rssi_poor");
        double critical = thresholds.get("rssi_critical");

        Map<String, Object> tiers = new LinkedHashMap<>();
        tiers.put("excellent", Stats.count(rssi, value -> value >= excellent));
        tiers.put("good", Stats.count(rssi, value -> value >= good && value < excellent));
        tiers.put("fair", Stats.count(rssi, value -> value >= poor && value < good));
        tiers.put("poor", Stats.count(rssi, value -> value >= critical && value < poor));
        tiers.put("critical", Stats.count(rssi, value -> value < critical));

        double belowPoor = Stats.percent(Stats.count(rssi, value -> value < poor), rssi.size());
        double belowCritical = Stats.percent(Stats.count(rssi, value -> value < critical), rssi.size());
        tiers.put("excellent_percentage", Stats.percent((Long) tiers.get("excellent"), rssi.size()));
        tiers.put("poor_percentage", belowPoor);
        tiers.put("critical_percentage", belowCritical);
        findings.metric("average_rssi", Stats.mean(rssi))
                .metric("signal_quality_distribution", tiers);

        double criticalLimit = thresholds.get("critical_signal_percentage_limit");
        double poorLimit = thresholds.get("poor_signal_percentage_limit");
        if (belowCritical > criticalLimit) {
            findings.alert(Alert.builder()
                    .alertType("CRITICAL_SIGNAL_QUALITY")
                    .level(AlertLevel.CRITICAL)
                    .message("Critical signal quality: " + Stats.oneDecimal(belowCritical)
                            + "% of measurements below " + Stats.oneDecimal(critical) + " dBm")
                    .metricValue(belowCritical)
                    .threshold(criticalLimit)
                    .build());
        } else if (belowPoor > poorLimit) {
            findings.alert(Alert.builder()
                    .alertType("POOR_SIGNAL_QUALITY")
                    .level(AlertLevel.WARNING)
                    .message("Poor signal quality: " + Stats.oneDecimal(belowPoor)
                            + "% of measurements below " + Stats.oneDecimal(poor) + " dBm")
                    .metricValue(belowPoor)
                    .threshold(poorLimit)
                    .build());
        }

        List<String> weakUnits = new ArrayList<>();
        units.forEach((unit, rows) -> {
            List<Double> unitRssi = Stats.numbers(table, rows, RSSI, value -> value >= 0);
            if (!unitRssi.isEmpty()
                    && Stats.percent(Stats.count(unitRssi, value -> value < critical), unitRssi.size()) > 20) {
                weakUnits.add(unitName(unit));
            }
        });
        if (!weakUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("UNITS_WITH_POOR_SIGNAL")
                    .level(AlertLevel.WARNING)
                    .message("Units with consistently poor signal: " + String.join(", ", weakUnits))
                    .affectedUnits(weakUnits)
                    .build());
        }
        return belowCritical;
    }

    // ---------------------------------------------------------------------
    // Modulation and coding
    // ---------------------------------------------------------------------

    private Double analyzeMcs(TelemetryTable table, Map<Object, List<Integer>> units,
                              ThresholdConfig thresholds, AnalysisFindings findings) {
        List<Double> mcs = Stats.numbers(table, MCS, value -> value >= 0);
        if (mcs.isEmpty()) {
            return null;
        }
        double optimalMin = thresholds.get("mcs_optimal_min");
        double optimalMax = thresholds.get("mcs_optimal_max");
        double efficiency = optimalShare(mcs, optimalMin, optimalMax);
        findings.metric("average_mcs", Stats.mean(mcs))
                .metric("mcs_suboptimal_percentage", Stats.percent(
                        Stats.count(mcs, value -> value < thresholds.get("mcs_minimum")), mcs.size()));

        if (efficiency < 50) {
            findings.alert(mcsAlert("LOW_MCS_EFFICIENCY", AlertLevel.CRITICAL, "Low", efficiency, 50));
        } else if (efficiency < 70) {
            findings.alert(mcsAlert("SUBOPTIMAL_MCS_EFFICIENCY", AlertLevel.WARNING, "Suboptimal", efficiency, 70));
        }

        List<String> inefficientUnits = new ArrayList<>();
        units.forEach((unit, rows) -> {
            List<Double> unitMcs = Stats.numbers(table, rows, MCS, value -> value >= 0);
            if (!unitMcs.isEmpty() && optimalShare(unitMcs, optimalMin, optimalMax) < 40) {
                inefficientUnits.add(unitName(unit));
            }
        });
        if (!inefficientUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("UNITS_LOW_MCS_EFFICIENCY")
                    .level(AlertLevel.WARNING)
                    .message("Units with low MCS efficiency: " + String.join(", ", inefficientUnits))
                    .affectedUnits(inefficientUnits)
                    .build());
        }
        return efficiency;
    }

    private static double optimalShare(List<Double> mcs, double min, double max) {
        return Stats.percent(Stats.count(mcs, value -> value >= min && value <= max), mcs.size());
    }

    private static Alert mcsAlert(String type, AlertLevel level, String label, double efficiency, double threshold) {
        return Alert.builder()
                .alertType(type)
                .level(level)
                .message(label + " MCS efficiency: " + Stats.oneDecimal(efficiency)
                        + "% of transmissions in optimal range")
                .metricValue(efficiency)
                .threshold(threshold)
                .build();
    }

    // ---------------------------------------------------------------------
    // Next-hop routing
    // ---------------------------------------------------------------------

    /**
     * Scores how evenly traffic spreads over next hops and counts units routed
     * through a single hop.
     *
     * @return the load balance score, or {@code null} when no routed reports exist
     */
    private Double analyzeNextHops(TelemetryTable table, Map<Object, List<Integer>> units, AnalysisFindings findings) {
        Map<String, Long> hopTraffic = new LinkedHashMap<>();
        for (Object cell : table.column(NEXT_HOP)) {
            String hop = routedHop(cell);
            if (hop != null) {
                hopTraffic.merge(hop, 1L, Long::sum);
            }
        }
        if (hopTraffic.isEmpty()) {
            return null;
        }
        double loadBalance = loadBalanceScore(hopTraffic.values());

        Map<String, String> redundancy = new LinkedHashMap<>();
        units.forEach((unit, rows) -> {
            Set<String> hops = new HashSet<>();
            rows.forEach(row -> {
                String hop = routedHop(table.getValue(row, NEXT_HOP));
                if (hop != null) {
                    hops.add(hop);
                }
            });
            if (!hops.isEmpty()) {
                redundancy.put(unitName(unit), hops.size() > 2 ? "High" : hops.size() == 2 ? "Medium" : "Low");
            }
        });
        List<String> singleHopUnits = redundancy.entrySet().stream()
                .filter(e -> e.getValue().equals("Low"))
                .map(Map.Entry::getKey)
                .toList();

        findings.metric("nexthop_usage", hopTraffic)
                .metric("total_nexthops", hopTraffic.size())
                .metric("load_balance_score", loadBalance)
                .metric("single_point_failures", singleHopUnits.size());

        if (loadBalance < 60) {
            findings.alert(Alert.builder()
                    .alertType("POOR_LOAD_DISTRIBUTION")
                    .level(AlertLevel.WARNING)
                    .message("Poor nexthop load distribution: " + Stats.oneDecimal(loadBalance) + "% balance score")
                    .metricValue(loadBalance)
                    .threshold(60.0)
                    .build());
        }
        if (!singleHopUnits.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("SINGLE_POINT_FAILURES")
                    .level(AlertLevel.WARNING)
                    .message(singleHopUnits.size() + " units have single nexthop dependency")
                    .affectedUnits(singleHopUnits)
                    .metricValue((double) singleHopUnits.size())
                    .build());
        }
        return loadBalance;
    }

    /**
     * Returns {@code 100 - stddev/mean * 100} over per-hop traffic counts, clamped to
     * [0, 100].
     */
    static double loadBalanceScore(Collection<Long> traffic) {
        double mean = Stats.mean(traffic);
        if (mean == 0) {
            return 0.0;
        }
        return Stats.clamp(100.0 - Stats.standardDeviation(traffic) / mean * 100.0, 0.0, 100.0);
    }

    private static String routedHop(Object cell) {
        String hop = Values.toText(cell);
        return hop == null || NEXT_HOP_UNAVAILABLE.equals(hop) ? null : hop;
    }

    // ---------------------------------------------------------------------
    // Blackouts
    // ---------------------------------------------------------------------

    @Value
    static class BlackoutSummary {

        int totalBlackouts;
        double averageDuration;
        double impactPercentage;

        double networkAvailability() {
            return 100.0 - impactPercentage;
        }
    }

    private BlackoutSummary analyzeBlackouts(TelemetryTable table, Map<Object, List<Integer>> units,
                                             ThresholdConfig thresholds, AnalysisFindings findings) {
        List<String> affectedUnits = new ArrayList<>();
        List<BlackoutPeriod> periods = new ArrayList<>();
        table.timelines(CALLSIGN, TIMESTAMP).forEach((unit, rows) -> {
            List<BlackoutPeriod> unitPeriods = BlackoutDetector.detect(table, rows);
            if (!unitPeriods.isEmpty()) {
                affectedUnits.add(unitName(unit));
                periods.addAll(unitPeriods);
            }
        });

        double totalDuration = periods.stream().mapToDouble(BlackoutPeriod::durationSeconds).sum();
        double averageDuration = periods.isEmpty() ? 0.0 : totalDuration / periods.size();
        double impact = Stats.percent(affectedUnits.size(), units.size());
        BlackoutSeverity severity = BlackoutSeverity.classify(impact, averageDuration);

        findings.metric("total_blackouts", periods.size())
                .metric("blackout_units_affected", affectedUnits.size())
                .metric("total_blackout_duration", totalDuration)
                .metric("average_blackout_duration", averageDuration)
                .metric("blackout_severity", severity.name());

        double critical = thresholds.get("blackout_duration_critical");
        double warning = thresholds.get("blackout_duration_warning");
        if (averageDuration > critical) {
            findings.alert(blackoutAlert("CRITICAL_BLACKOUT_DURATION", AlertLevel.CRITICAL, "Critical",
                    averageDuration, critical));
        } else if (averageDuration > warning) {
            findings.alert(blackoutAlert("LONG_BLACKOUT_DURATION", AlertLevel.WARNING, "Long",
                    averageDuration, warning));
        }
        if (impact > 25) {
            findings.alert(Alert.builder()
                    .alertType("WIDESPREAD_BLACKOUTS")
                    .level(AlertLevel.CRITICAL)
                    .message("Widespread communication blackouts: " + Stats.oneDecimal(impact) + "% of units affected")
                    .affectedUnits(affectedUnits)
                    .metricValue(impact)
                    .threshold(25.0)
                    .build());
        }
        return new BlackoutSummary(periods.size(), averageDuration, impact);
    }

    private static Alert blackoutAlert(String type, AlertLevel level, String label, double duration, double threshold) {
        return Alert.builder()
                .alertType(type)
                .level(level)
                .message(label + " blackout duration: " + Stats.oneDecimal(duration) + "s average")
                .metricValue(duration)
                .threshold(threshold)
                .build();
    }

    // ---------------------------------------------------------------------
    // Transmission quality
    // ---------------------------------------------------------------------

    private void analyzeTransmission(TelemetryTable table, int unitCount, ThresholdConfig thresholds,
                                     AnalysisFindings findings) {
        long expected = (long) (timespanSeconds(table) / REPORT_INTERVAL_SECONDS * unitCount);
        double packetLoss = expected > 0 ? Math.max(0.0, (double) (expected - table.size()) / expected) : 0.0;

        List<Double> scores = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.getRows()) {
            scores.add(transmissionScore(row, thresholds));
        }
        double averageScore = Stats.mean(scores);
        findings.metric("average_transmission_quality", averageScore)
                .metric("estimated_packet_loss", packetLoss * 100)
                .metric("transmission_reliability", 100 - packetLoss * 100);

        double critical = thresholds.get("packet_loss_critical");
        double warning = thresholds.get("packet_loss_warning");
        if (packetLoss > critical) {
            findings.alert(packetLossAlert("CRITICAL_PACKET_LOSS", AlertLevel.CRITICAL, "Critical", packetLoss, critical));
        } else if (packetLoss > warning) {
            findings.alert(packetLossAlert("HIGH_PACKET_LOSS", AlertLevel.WARNING, "High", packetLoss, warning));
        }
        if (!scores.isEmpty() && averageScore < 60) {
            findings.alert(Alert.builder()
                    .alertType("POOR_TRANSMISSION_QUALITY")
                    .level(AlertLevel.WARNING)
                    .message("Poor transmission quality: " + Stats.oneDecimal(averageScore) + "% average score")
                    .metricValue(averageScore)
                    .threshold(60.0)
                    .build());
        }
    }

    /**
     * Scores one report from 100: minus 40 for RSSI below {@code rssi_poor} (20 below
     * {@code rssi_good}), minus 30 for MCS below {@code mcs_minimum} (15 below
     * {@code mcs_optimal_min}). Sentinel readings are not penalized.
     */
    static double transmissionScore(Map<String, Object> row, ThresholdConfig thresholds) {
        double score = 100.0;
        Double rssi = Values.toDouble(row.get(RSSI));
        if (rssi != null && rssi >= 0) {
            if (rssi < thresholds.get("rssi_poor")) {
                score -= 40;
            } else if (rssi < thresholds.get("rssi_good")) {
                score -= 20;
            }
        }
        Double mcs = Values.toDouble(row.get(MCS));
        if (mcs != null && mcs >= 0) {
            if (mcs < thresholds.get("mcs_minimum")) {
                score -= 30;
            } else if (mcs < thresholds.get("mcs_optimal_min")) {
                score -= 15;
            }
        }
        return Math.max(score, 0.0);
    }

    private static Alert packetLossAlert(String type, AlertLevel level, String label, double loss, double threshold) {
        return Alert.builder()
                .alertType(type)
                .level(level)
                .message(label + " packet loss detected: " + Stats.oneDecimal(loss * 100) + "%")
                .metricValue(loss * 100)
                .threshold(threshold * 100)
                .build();
    }

    // ---------------------------------------------------------------------
    // Coverage
    // ---------------------------------------------------------------------

    /**
     * Buckets located RSSI readings into a lat/lon grid and rates each occupied cell.
     *
     * @return the percentage of occupied cells with good signal, or {@code null} when
     *         no located readings exist
     */
    private Double analyzeCoverage(TelemetryTable table, ThresholdConfig thresholds, AnalysisFindings findings) {
        CoverageGrid grid = CoverageGrid.build(table, COVERAGE_GRID_SIZE);
        if (grid.isEmpty()) {
            return null;
        }
        double good = thresholds.get("rssi_good");
        double poor = thresholds.get("rssi_poor");
        Map<String, Double> cells = grid.averageRssiByCell();
        long goodCells = cells.values().stream().filter(rssi -> rssi > good).count();
        List<String> gaps = cells.entrySet().stream()
                .filter(cell -> cell.getValue() < poor)
                .map(Map.Entry::getKey)
                .toList();
        double coverage = Stats.percent(goodCells, cells.size());

        findings.metric("coverage_percentage", coverage)
                .metric("coverage_areas", cells.size())
                .metric("coverage_gap_areas", gaps);

        if (coverage < 70) {
            findings.alert(Alert.builder()
                    .alertType("POOR_NETWORK_COVERAGE")
                    .level(AlertLevel.WARNING)
                    .message("Poor network coverage: " + Stats.oneDecimal(coverage) + "% of areas have good signal")
                    .metricValue(coverage)
                    .threshold(70.0)
                    .build());
        }
        if (!gaps.isEmpty()) {
            findings.alert(Alert.builder()
                    .alertType("COVERAGE_GAPS_DETECTED")
                    .level(AlertLevel.WARNING)
                    .message(gaps.size() + " coverage gap areas identified")
                    .metricValue((double) gaps.size())
                    .build());
        }
        return coverage;
    }

    // ---------------------------------------------------------------------

    private static double timespanSeconds(TelemetryTable table) {
        if (!table.hasColumn(TIMESTAMP)) {
            return 0.0;
        }
        List<Instant> times = table.column(TIMESTAMP).stream()
                .map(Values::toInstant)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        if (times.isEmpty()) {
            return 0.0;
        }
        return Duration.between(times.get(0), times.get(times.size() - 1)).toMillis() / 1000.0;
    }

    private static void recommend(AnalysisFindings findings, Double criticalShare, Double mcsEfficiency,
                                  Double loadBalance, int totalBlackouts, Double coverage) {
        if (criticalShare != null && criticalShare > 10) {
            findings.recommend("CRITICAL: Investigate and resolve signal quality issues - over 10% of measurements are critical");
        }
        if (mcsEfficiency != null && mcsEfficiency < 60) {
            findings.recommend("Optimize MCS settings and review adaptive modulation algorithms");
        }
        if (loadBalance != null && loadBalance < 60) {
            findings.recommend("Rebalance nexthop load distribution to improve network efficiency");
        }
        if (totalBlackouts > 0) {
            findings.recommend("Implement redundant communication pathways to prevent blackouts");
        }
        if (coverage != null && coverage < 80) {
            findings.recommend("Expand network infrastructure to address coverage gaps");
        }
        if (findings.getRecommendations().isEmpty()) {
            findings.recommend("Network performance within acceptable parameters - continue monitoring");
        }
    }
}
