package fr.lapetina.fleet.layout.domain.layout;

import fr.lapetina.fleet.layout.FleetFixtures;
import fr.lapetina.fleet.layout.domain.model.FleetConfig;
import fr.lapetina.fleet.layout.domain.model.InstanceProperties;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LayoutTest {

    private FleetConfig config;
    private Layout layout;

    @BeforeEach
    void setUp() {
        config = FleetFixtures.fleet()
                .nshards(2)
                .metadata("m1", "r1", "az1")
                .metadata("m2", "r1", "az1")
                .storage("s1", 64, "r1", "az1")
                .load();
        layout = new Layout(config);
    }

    private static String print(Consumer<PrintStream> printer) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream stream = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        printer.accept(stream);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Views")
    class ViewTests {

        @Test
        @DisplayName("should feed every view from the same placements")
        void shouldUpdateAllViews() {
            layout.record("m1", ServiceRole.WEBAPI, InstanceProperties.ofImage("web"));
            layout.record("m2", ServiceRole.WEBAPI, InstanceProperties.ofImage("web"));
            layout.record("m2", ServiceRole.WEBAPI, InstanceProperties.ofImage("web"));

            assertThat(layout.getServerConfigurations("m2").get(ServiceRole.WEBAPI).total()).isEqualTo(2);
            assertThat(layout.getServiceConfigurationsByAz(ServiceRole.WEBAPI).get("az1").total()).isEqualTo(3);
            assertThat(layout.getServiceConfiguration(ServiceRole.WEBAPI).orElseThrow().total()).isEqualTo(3);
            assertThat(layout.deployedServices()).containsExactly(ServiceRole.WEBAPI);
        }

        @Test
        @DisplayName("should list deployed services in canonical order")
        void shouldOrderServices() {
            layout.record("m1", ServiceRole.OPS, InstanceProperties.ofImage("ops"));
            layout.record("m1", ServiceRole.NAMESERVICE, InstanceProperties.ofImage("ns"));

            assertThat(layout.deployedServices()).containsExactly(ServiceRole.NAMESERVICE, ServiceRole.OPS);
        }

        @Test
        @DisplayName("should report nothing for idle servers")
        void shouldHandleIdleServers() {
            assertThat(layout.getServerConfigurations("m1")).isEmpty();
            assertThat(layout.getServiceConfiguration(ServiceRole.OPS)).isEmpty();
        }

        @Test
        @DisplayName("should reject servers outside the fleet")
        void shouldRejectUnknownServer() {
            assertThatThrownBy(() -> layout.record("nope", ServiceRole.OPS, InstanceProperties.ofImage("ops")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Serialization")
    class SerializationTests {

        @Test
        @DisplayName("should write metadata servers first with services sorted by name")
        void shouldSerialize() {
            layout.record("s1", ServiceRole.STORAGE, InstanceProperties.ofImage("st"));
            layout.record("m1", ServiceRole.POSTGRES, InstanceProperties.ofShard(1, "pg"));
            layout.record("m1", ServiceRole.NAMESERVICE, InstanceProperties.ofImage("ns"));
            layout.record("m1", ServiceRole.POSTGRES, InstanceProperties.ofShard(1, "pg"));
            layout.seal();

            String expected = "{\n"
                    + "    \"m1\": {\n"
                    + "        \"nameservice\": [\n"
                    + "            {\n"
                    + "                \"image_uuid\": \"ns\",\n"
                    + "                \"count\": 1\n"
                    + "            }\n"
                    + "        ],\n"
                    + "        \"postgres\": [\n"
                    + "            {\n"
                    + "                \"shard\": 1,\n"
                    + "                \"image_uuid\": \"pg\",\n"
                    + "                \"count\": 2\n"
                    + "            }\n"
                    + "        ]\n"
                    + "    },\n"
                    + "    \"m2\": {},\n"
                    + "    \"s1\": {\n"
                    + "        \"storage\": [\n"
                    + "            {\n"
                    + "                \"image_uuid\": \"st\",\n"
                    + "                \"count\": 1\n"
                    + "            }\n"
                    + "        ]\n"
                    + "    }\n"
                    + "}\n";

            assertThat(layout.serialize("az1")).contains(expected);
        }

        @Test
        @DisplayName("should refuse to serialize a layout with errors")
        void shouldNotSerializeErrors() {
            layout.addError("broken");

            assertThat(layout.serialize("az1")).isEmpty();
        }

        @Test
        @DisplayName("should reject unknown availability zones")
        void shouldRejectUnknownZone() {
            assertThatThrownBy(() -> layout.serialize("elsewhere"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("elsewhere");
        }

        @Test
        @DisplayName("should only include servers of the requested zone")
        void shouldFilterByZone() {
            FleetConfig zones = FleetFixtures.fleet()
                    .metadata("a-m", "a1", "az-a")
                    .storage("a-s", 64, "a1", "az-a")
                    .metadata("b-m", "b1", "az-b")
                    .storage("b-s", 64, "b1", "az-b")
                    .load();

            Map<String, Object> document = LayoutSerializer.toDocument(new Layout(zones), "az-b");

            assertThat(document).containsOnlyKeys("b-m", "b-s");
        }
    }

    @Nested
    @DisplayName("Reports")
    class ReportTests {

        @Test
        @DisplayName("should print warnings when there are no errors")
        void shouldPrintWarnings() {
            layout.addWarning("first");
            layout.addWarning("second");

            assertThat(print(out -> LayoutReport.printIssues(layout, out)))
                    .isEqualTo("warning: first" + System.lineSeparator() + "warning: second" + System.lineSeparator());
        }

        @Test
        @DisplayName("should print only errors when there are errors")
        void shouldPrintErrorsOnly() {
            layout.addWarning("minor");
            layout.addError("fatal");

            assertThat(print(out -> LayoutReport.printIssues(layout, out)))
                    .isEqualTo("error: fatal" + System.lineSeparator());
        }

        @Test
        @DisplayName("should summarize every service per zone, shards last")
        void shouldPrintSummary() {
            layout.record("m1", ServiceRole.POSTGRES, InstanceProperties.ofShard(2, "pg"));
            layout.record("m2", ServiceRole.POSTGRES, InstanceProperties.ofShard(1, "pg"));
            layout.record("m1", ServiceRole.WEBAPI, InstanceProperties.ofImage("web"));
            layout.record("m2", ServiceRole.WEBAPI, InstanceProperties.ofImage("web"));

            String[] lines = print(out -> LayoutReport.printSummary(layout, out)).split(System.lineSeparator());

            // Header, 15 services without shards, then the two postgres shards
            assertThat(lines).hasSize(18);
            assertThat(lines[0].trim().split("\\s+")).containsExactly("SERVICE", "SHARD", "az1");
            assertThat(lines[1].trim().split("\\s+")).containsExactly("nameservice", "-");
            assertThat(lines[5].trim().split("\\s+")).containsExactly("webapi", "-", "2");
            assertThat(lines[15].trim().split("\\s+")).containsExactly("propeller", "-");
            assertThat(lines[16].trim().split("\\s+")).containsExactly("postgres", "1", "1");
            assertThat(lines[17].trim().split("\\s+")).containsExactly("postgres", "2", "1");
        }

        @Test
        @DisplayName("should list services without instances with blank counts")
        void shouldListIdleServices() {
            String summary = print(out -> LayoutReport.printSummary(layout, out));

            assertThat(summary.split(System.lineSeparator())).hasSize(16);
            assertThat(summary).contains("storage", "marlin-dashboard", "reshard").doesNotContain("postgres");
        }

        @Test
        @DisplayName("should print no summary for a layout with errors")
        void shouldSkipSummaryOnErrors() {
            layout.addError("fatal");

            assertThat(print(out -> LayoutReport.printSummary(layout, out))).isEmpty();
        }
    }
}
