package fr.lapetina.fleet.layout.domain.placement;

import fr.lapetina.fleet.layout.domain.model.ServiceRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyTableTest {

    @Test
    @DisplayName("should define a policy for every service")
    void shouldCoverEveryService() {
        assertThat(PolicyTable.all()).containsOnlyKeys(ServiceRole.values());
    }

    @Test
    @DisplayName("should use per-shard placement exactly for sharded services")
    void shouldPlaceShardedServicesPerShard() {
        for (ServiceRole role : ServiceRole.values()) {
            boolean perShard = PolicyTable.policyFor(role).kind() == PlacementPolicy.Kind.PER_SHARD;
            assertThat(perShard).as(role.getServiceName()).isEqualTo(role.isSharded());
        }
    }

    @Test
    @DisplayName("should assign the documented policies")
    void shouldAssignPolicies() {
        assertThat(PolicyTable.policyFor(ServiceRole.NAMESERVICE)).isEqualTo(PlacementPolicy.fixedCount(3));
        assertThat(PolicyTable.policyFor(ServiceRole.OPS)).isEqualTo(PlacementPolicy.fixedCount(1));
        assertThat(PolicyTable.policyFor(ServiceRole.JOBPULLER)).isEqualTo(PlacementPolicy.fixedCount(2));
        assertThat(PolicyTable.policyFor(ServiceRole.PROPELLER)).isEqualTo(PlacementPolicy.fixedCount(0));
        assertThat(PolicyTable.policyFor(ServiceRole.AUTHCACHE)).isEqualTo(PlacementPolicy.frontdoorRatio(1));
        assertThat(PolicyTable.policyFor(ServiceRole.WEBAPI)).isEqualTo(PlacementPolicy.frontdoorRatio(8));
        assertThat(PolicyTable.policyFor(ServiceRole.POSTGRES)).isEqualTo(PlacementPolicy.perShard(3));
        assertThat(PolicyTable.policyFor(ServiceRole.STORAGE).kind())
                .isEqualTo(PlacementPolicy.Kind.ONE_PER_STORAGE_NODE);
        assertThat(PolicyTable.policyFor(ServiceRole.MARLIN).kind()).isEqualTo(PlacementPolicy.Kind.CAPACITY_DERIVED);
        assertThat(PolicyTable.policyFor(ServiceRole.RESHARD).kind()).isEqualTo(PlacementPolicy.Kind.UNPLACED);
    }

    @Nested
    @DisplayName("Front door count")
    class FrontdoorTests {

        @Test
        @DisplayName("should give the largest ratio one instance per metadata server")
        void shouldScaleWithMetadataServers() {
            assertThat(PolicyTable.frontdoorCount(8, 24)).isEqualTo(24);
            assertThat(PolicyTable.frontdoorCount(8, 5)).isEqualTo(5);
        }

        @Test
        @DisplayName("should scale smaller ratios down, rounding up")
        void shouldRoundUp() {
            assertThat(PolicyTable.frontdoorCount(1, 24)).isEqualTo(3);
            assertThat(PolicyTable.frontdoorCount(1, 25)).isEqualTo(4);
        }

        @Test
        @DisplayName("should never go below two instances")
        void shouldApplyFloor() {
            assertThat(PolicyTable.frontdoorCount(8, 1)).isEqualTo(2);
            assertThat(PolicyTable.frontdoorCount(1, 3)).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject non-positive ratios")
        void shouldRejectZeroRatio() {
            assertThatThrownBy(() -> PlacementPolicy.frontdoorRatio(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Compute count")
    class ComputeTests {

        @Test
        @DisplayName("should give a quarter of memory to one-gigabyte zones")
        void shouldUseQuarterOfMemory() {
            assertThat(PolicyTable.computeCount(64)).isEqualTo(16);
            assertThat(PolicyTable.computeCount(20)).isEqualTo(5);
            assertThat(PolicyTable.computeCount(22)).isEqualTo(5);
        }

        @Test
        @DisplayName("should place at least four zones on small servers")
        void shouldApplyMinimum() {
            assertThat(PolicyTable.computeCount(1)).isEqualTo(4);
            assertThat(PolicyTable.computeCount(16)).isEqualTo(4);
        }
    }
}
