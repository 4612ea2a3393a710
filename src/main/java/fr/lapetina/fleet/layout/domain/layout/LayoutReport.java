package fr.lapetina.fleet.layout.domain.layout;

import fr.lapetina.fleet.layout.domain.model.InstanceProperties;
import fr.lapetina.fleet.layout.domain.model.ServiceConfiguration;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable reports over a generated {@link Layout}.
 */
public final class LayoutReport {

    private static final int MARGIN_WIDTH = 4;
    private static final int SERVICE_WIDTH = 16;
    private static final int SHARD_WIDTH = 5;
    private static final int AZ_WIDTH = 16;

    private LayoutReport() {
        // Utility class
    }

    /**
     * Prints every error, or every warning when there are no errors.
     */
    public static void printIssues(Layout layout, PrintStream out) {
        List<LayoutIssue> issues = layout.nerrors() > 0 ? layout.errors() : layout.warnings();
        for (LayoutIssue issue : issues) {
            out.println(issue);
        }
    }

    /**
     * Prints a table of instance counts per availability zone: one row per
     * non-sharded service, deployed or not, then one row per shard of each
     * sharded service. Prints nothing for a layout with errors.
     */
    public static void printSummary(Layout layout, PrintStream out) {
        if (layout.nerrors() > 0) {
            return;
        }

        List<String> azs = layout.azs();
        List<String> header = new ArrayList<>();
        header.add("");
        header.add("SERVICE");
        header.add("SHARD");
        header.addAll(azs);
        out.println(formatRow(header));

        for (ServiceRole role : ServiceRole.values()) {
            if (role.isSharded()) {
                continue;
            }
            List<String> row = new ArrayList<>();
            row.add("");
            row.add(role.getServiceName());
            row.add("-");
            Map<String, ServiceConfiguration> byAz = layout.getServiceConfigurationsByAz(role);
            for (String az : azs) {
                ServiceConfiguration config = byAz.get(az);
                row.add(config != null ? String.valueOf(config.total()) : "");
            }
            out.println(formatRow(row));
        }

        for (ServiceRole role : ServiceRole.values()) {
            if (!role.isSharded()) {
                continue;
            }
            for (Map.Entry<Integer, Map<String, Integer>> shardRow : countsByShard(layout, role).entrySet()) {
                List<String> row = new ArrayList<>();
                row.add("");
                row.add(role.getServiceName());
                row.add(String.valueOf(shardRow.getKey()));
                for (String az : azs) {
                    Integer count = shardRow.getValue().get(az);
                    row.add(count != null ? String.valueOf(count) : "");
                }
                out.println(formatRow(row));
            }
        }
    }

    /**
     * Shard number to availability zone to instance count, shards in numeric order.
     */
    static TreeMap<Integer, Map<String, Integer>> countsByShard(Layout layout, ServiceRole role) {
        TreeMap<Integer, Map<String, Integer>> rows = new TreeMap<>();
        for (Map.Entry<String, ServiceConfiguration> byAz : layout.getServiceConfigurationsByAz(role).entrySet()) {
            for (Map.Entry<InstanceProperties, Integer> bucket : byAz.getValue().buckets().entrySet()) {
                rows.computeIfAbsent(bucket.getKey().shard(), shard -> new LinkedHashMap<>())
                        .merge(byAz.getKey(), bucket.getValue(), Integer::sum);
            }
        }
        return rows;
    }

    private static String formatRow(List<String> cells) {
        StringBuilder line = new StringBuilder();
        line.append(String.format("%-" + MARGIN_WIDTH + "s", cells.get(0)));
        line.append(' ').append(String.format("%-" + SERVICE_WIDTH + "s", cells.get(1)));
        line.append(' ').append(String.format("%" + SHARD_WIDTH + "s", cells.get(2)));
        for (int i = 3; i < cells.size(); i++) {
            line.append(' ').append(String.format("%" + AZ_WIDTH + "s", cells.get(i)));
        }
        return line.toString().stripTrailing();
    }
}
