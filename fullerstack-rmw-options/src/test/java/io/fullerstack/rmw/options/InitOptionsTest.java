package io.fullerstack.rmw.options;

import io.fullerstack.rmw.RmwImplementation;
import io.fullerstack.rmw.ReturnCode;
import io.fullerstack.rmw.config.RmwConfig;
import io.fullerstack.rmw.error.ErrorState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InitOptionsTest {

    private CountingAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new CountingAllocator();
        ErrorState.reset();
    }

    @AfterEach
    void tearDown() {
        ErrorState.reset();
    }

    /**
     * Initialized options with an enclave, a security root and three static peers,
     * all owned by the counting allocator.
     */
    private InitOptions populatedSource() {
        InitOptions src = InitOptions.zeroInitialized();
        assertThat(src.init(allocator)).isEqualTo(ReturnCode.OK);
        src.setInstanceId(7);
        src.setDomainId(42);
        src.setEnclave(allocator.allocate(() -> "/robot/arm"));
        src.setSecurityOptions(new SecurityOptions(EnforcementPolicy.ENFORCE, allocator.allocate(() -> "/etc/keys")));
        src.setDiscoveryOptions(DiscoveryOptions.of(
            AutomaticDiscoveryRange.SUBNET,
            List.of("tcp/10.0.0.1:7447", "tcp/10.0.0.2:7447", "tcp/10.0.0.3:7447"),
            allocator
        ));
        return src;
    }

    @Nested
    class Init {

        @Test
        void shouldApplyDefaults() {
            InitOptions options = InitOptions.zeroInitialized();

            assertThat(options.init(allocator)).isEqualTo(ReturnCode.OK);

            assertThat(options.isInitialized()).isTrue();
            assertThat(options.implementationIdentifier()).isEqualTo(RmwImplementation.IDENTIFIER);
            assertThat(options.domainId()).isEqualTo(InitOptions.DEFAULT_DOMAIN_ID);
            assertThat(options.enclave()).isNull();
            assertThat(options.instanceId()).isZero();
            assertThat(options.allocator()).isSameAs(allocator);
            assertThat(options.securityOptions()).isEqualTo(SecurityOptions.defaults());
            assertThat(options.discoveryOptions().automaticDiscoveryRange()).isEqualTo(AutomaticDiscoveryRange.LOCALHOST);
            assertThat(options.discoveryOptions().staticPeers()).isEmpty();
        }

        @Test
        void shouldRejectNullAllocator() {
            InitOptions options = InitOptions.zeroInitialized();

            assertThat(options.init(null)).isEqualTo(ReturnCode.INVALID_ARGUMENT);
            assertThat(options.isInitialized()).isFalse();
            assertThat(ErrorState.get()).contains("allocator");
        }

        @Test
        void shouldReportInvalidConfiguredRangeWithoutThrowing() {
            System.setProperty(RmwConfig.DISCOVERY_AUTOMATIC_RANGE, "bogus");
            try {
                InitOptions options = InitOptions.zeroInitialized();

                assertThat(options.init(allocator)).isEqualTo(ReturnCode.ERROR);
                assertThat(options.isInitialized()).isFalse();
                assertThat(ErrorState.get()).contains("bogus");
                assertThat(allocator.live()).isZero();
            } finally {
                System.clearProperty(RmwConfig.DISCOVERY_AUTOMATIC_RANGE);
            }
        }

        @Test
        void shouldApplyConfiguredRange() {
            System.setProperty(RmwConfig.DISCOVERY_AUTOMATIC_RANGE, "subnet");
            try {
                InitOptions options = InitOptions.zeroInitialized();

                assertThat(options.init(allocator)).isEqualTo(ReturnCode.OK);
                assertThat(options.discoveryOptions().automaticDiscoveryRange()).isEqualTo(AutomaticDiscoveryRange.SUBNET);
            } finally {
                System.clearProperty(RmwConfig.DISCOVERY_AUTOMATIC_RANGE);
            }
        }

        @Test
        void shouldRejectSecondInit() {
            InitOptions options = InitOptions.zeroInitialized();
            options.init(allocator);

            assertThat(options.init(allocator)).isEqualTo(ReturnCode.INVALID_ARGUMENT);
            assertThat(ErrorState.get()).isEqualTo("expected zero-initialized init_options");
        }
    }

    @Nested
    class Copy {

        @Test
        void shouldDeepCopyEveryField() {
            InitOptions src = populatedSource();
            InitOptions dst = InitOptions.zeroInitialized();

            assertThat(InitOptions.copy(src, dst)).isEqualTo(ReturnCode.OK);

            assertThat(dst.isInitialized()).isTrue();
            assertThat(dst.instanceId()).isEqualTo(7);
            assertThat(dst.domainId()).isEqualTo(42);
            assertThat(dst.allocator()).isSameAs(allocator);
            assertThat(dst.enclave()).isEqualTo("/robot/arm").isNotSameAs(src.enclave());
            assertThat(dst.securityOptions()).isEqualTo(src.securityOptions());
            assertThat(dst.securityOptions().securityRootPath()).isNotSameAs(src.securityOptions().securityRootPath());
            assertThat(dst.discoveryOptions()).isEqualTo(src.discoveryOptions());
            assertThat(dst.discoveryOptions().staticPeers().get(2))
                .isNotSameAs(src.discoveryOptions().staticPeers().get(2));
            assertThat(allocator.owns(dst.enclave())).isTrue();
        }

        @Test
        void shouldLeaveSourceUsableAfterCopy() {
            InitOptions src = populatedSource();
            InitOptions dst = InitOptions.zeroInitialized();
            InitOptions.copy(src, dst);

            assertThat(dst.fini()).isEqualTo(ReturnCode.OK);

            assertThat(src.discoveryOptions().staticPeers()).hasSize(3);
            assertThat(src.fini()).isEqualTo(ReturnCode.OK);
            assertThat(allocator.live()).isZero();
        }

        @Test
        void shouldRejectNullArguments() {
            InitOptions src = populatedSource();

            assertThat(InitOptions.copy(null, InitOptions.zeroInitialized())).isEqualTo(ReturnCode.INVALID_ARGUMENT);
            assertThat(InitOptions.copy(src, null)).isEqualTo(ReturnCode.INVALID_ARGUMENT);
        }

        @Test
        void shouldRejectUninitializedSource() {
            InitOptions dst = InitOptions.zeroInitialized();

            assertThat(InitOptions.copy(InitOptions.zeroInitialized(), dst)).isEqualTo(ReturnCode.INVALID_ARGUMENT);
            assertThat(ErrorState.get()).isEqualTo("expected initialized src");
            assertThat(dst.isInitialized()).isFalse();
        }

        @Test
        void shouldRejectInitializedDestination() {
            InitOptions src = populatedSource();
            InitOptions dst = InitOptions.zeroInitialized();
            dst.init(allocator);

            assertThat(InitOptions.copy(src, dst)).isEqualTo(ReturnCode.INVALID_ARGUMENT);
            assertThat(ErrorState.get()).isEqualTo("expected zero-initialized dst");
            assertThat(dst.domainId()).isEqualTo(InitOptions.DEFAULT_DOMAIN_ID);
        }

        @Test
        void shouldRejectForeignSource() {
            InitOptions src = populatedSource();
            src.setImplementationIdentifier("rmw_other");
            InitOptions dst = InitOptions.zeroInitialized();

            assertThat(InitOptions.copy(src, dst)).isEqualTo(ReturnCode.INCORRECT_RMW_IMPLEMENTATION);
            assertThat(ErrorState.get()).contains("rmw_other");
            assertThat(dst.isInitialized()).isFalse();
        }

        // src owns 1 enclave + 1 root + 1 table + 3 peers; a full copy needs root, table, 3 peers, enclave
        @ParameterizedTest(name = "allocation {0} fails")
        @CsvSource({
            "0, failed to copy security options",
            "1, failed to copy discovery options",
            "2, failed to copy discovery options",
            "3, failed to copy discovery options",
            "4, failed to copy discovery options",
            "5, failed to copy enclave"
        })
        void shouldLeaveDestinationUntouchedOnAllocationFailure(int successes, String message) {
            InitOptions src = populatedSource();
            int ownedBySource = allocator.live();
            InitOptions dst = InitOptions.zeroInitialized();
            allocator.failAfter(successes);

            assertThat(InitOptions.copy(src, dst)).isEqualTo(ReturnCode.BAD_ALLOC);

            assertThat(ErrorState.get()).isEqualTo(message);
            assertThat(allocator.live()).isEqualTo(ownedBySource);
            assertThat(dst.isInitialized()).isFalse();
            assertThat(dst.implementationIdentifier()).isNull();
            assertThat(dst.enclave()).isNull();
            assertThat(dst.allocator()).isNull();
            assertThat(dst.securityOptions()).isEqualTo(SecurityOptions.defaults());
            assertThat(dst.discoveryOptions()).isEqualTo(DiscoveryOptions.zeroInitialized());
        }

        @Test
        void shouldSucceedOnRetryAfterAllocationFailure() {
            InitOptions src = populatedSource();
            InitOptions dst = InitOptions.zeroInitialized();
            allocator.failAfter(3);
            assertThat(InitOptions.copy(src, dst)).isEqualTo(ReturnCode.BAD_ALLOC);

            allocator.unlimited();

            assertThat(InitOptions.copy(src, dst)).isEqualTo(ReturnCode.OK);
            assertThat(dst.discoveryOptions().staticPeers()).hasSize(3);
        }
    }

    @Nested
    class Fini {

        @Test
        void shouldReleaseEverythingAndReturnToZeroState() {
            InitOptions options = populatedSource();

            assertThat(options.fini()).isEqualTo(ReturnCode.OK);

            assertThat(allocator.live()).isZero();
            assertThat(options.isInitialized()).isFalse();
            assertThat(options.enclave()).isNull();
            assertThat(options.domainId()).isZero();
            assertThat(options.discoveryOptions()).isEqualTo(DiscoveryOptions.zeroInitialized());
        }

        @Test
        void shouldAllowInitAfterFini() {
            InitOptions options = populatedSource();
            options.fini();

            assertThat(options.init(allocator)).isEqualTo(ReturnCode.OK);
        }

        @Test
        void shouldRejectUninitializedOptions() {
            assertThat(InitOptions.zeroInitialized().fini()).isEqualTo(ReturnCode.INVALID_ARGUMENT);
            assertThat(ErrorState.get()).isEqualTo("expected initialized init_options");
        }

        @Test
        void shouldRejectForeignOptionsWithoutReleasing() {
            InitOptions options = populatedSource();
            int owned = allocator.live();
            options.setImplementationIdentifier("rmw_other");

            assertThat(options.fini()).isEqualTo(ReturnCode.INCORRECT_RMW_IMPLEMENTATION);
            assertThat(allocator.live()).isEqualTo(owned);
        }
    }
}
