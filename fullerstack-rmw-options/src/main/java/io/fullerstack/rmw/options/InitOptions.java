package io.fullerstack.rmw.options;

import io.fullerstack.rmw.RmwImplementation;
import io.fullerstack.rmw.ReturnCode;
import io.fullerstack.rmw.config.ConfigurationException;
import io.fullerstack.rmw.config.RmwConfig;
import io.fullerstack.rmw.error.ErrorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Options used to initialize the middleware: domain id, enclave, security and discovery
 * settings, and the allocator that owns their sub-resources.
 *
 * <h3>Lifecycle</h3>
 * <pre>
 * zeroInitialized() --init(allocator)--> initialized --fini()--> zero state
 *                                        initialized --copy(src, zeroDst)--> dst initialized
 * </pre>
 * The lifecycle operations report failure through {@link ReturnCode} and a message in
 * {@link ErrorState}; they do not throw. {@link #copy} is all-or-nothing: on failure every
 * block already copied is released and the destination is left as it was.
 */
public final class InitOptions {

    private static final Logger logger = LoggerFactory.getLogger(InitOptions.class);

    /** Domain id meaning "use the default domain". */
    public static final long DEFAULT_DOMAIN_ID = Long.MAX_VALUE;

    private long instanceId;
    private String implementationIdentifier;
    private long domainId;
    private String enclave;
    private SecurityOptions securityOptions;
    private DiscoveryOptions discoveryOptions;
    private Allocator allocator;

    private InitOptions() {
        clear();
    }

    public static InitOptions zeroInitialized() {
        return new InitOptions();
    }

    /**
     * Initializes zero-initialized options with the defaults of this implementation.
     *
     * @param allocator allocator owning the options' sub-resources
     * @return {@link ReturnCode#OK}, {@link ReturnCode#INVALID_ARGUMENT} if the allocator is
     * null or the options are already initialized, {@link ReturnCode#ERROR} if the configured
     * discovery range is not a valid range, {@link ReturnCode#BAD_ALLOC} if the
     * discovery options cannot be allocated
     */
    public ReturnCode init(Allocator allocator) {
        if (allocator == null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "allocator argument is null");
        }
        if (implementationIdentifier != null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "expected zero-initialized init_options");
        }

        AutomaticDiscoveryRange range;
        try {
            range = RmwConfig.global().getEnum(
                RmwConfig.DISCOVERY_AUTOMATIC_RANGE, AutomaticDiscoveryRange.class, AutomaticDiscoveryRange.LOCALHOST
            );
        } catch (ConfigurationException e) {
            return fail(ReturnCode.ERROR, e.getMessage());
        }
        DiscoveryOptions discovery = DiscoveryOptions.of(range, List.of(), allocator);
        if (discovery == null) {
            return fail(ReturnCode.BAD_ALLOC, "failed to allocate discovery options");
        }

        this.instanceId = 0;
        this.implementationIdentifier = RmwImplementation.IDENTIFIER;
        this.allocator = allocator;
        this.enclave = null;
        this.domainId = DEFAULT_DOMAIN_ID;
        this.securityOptions = SecurityOptions.defaults();
        this.discoveryOptions = discovery;
        return ReturnCode.OK;
    }

    /**
     * Deep-copies {@code src} into zero-initialized {@code dst}, allocating through
     * {@code src}'s allocator.
     *
     * @return {@link ReturnCode#OK}; {@link ReturnCode#INVALID_ARGUMENT} for null arguments,
     * an uninitialized {@code src} or an initialized {@code dst};
     * {@link ReturnCode#INCORRECT_RMW_IMPLEMENTATION} if {@code src} belongs to another
     * implementation; {@link ReturnCode#BAD_ALLOC} if any allocation fails, in which case
     * {@code dst} is unchanged and nothing stays allocated
     */
    public static ReturnCode copy(InitOptions src, InitOptions dst) {
        if (src == null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "src argument is null");
        }
        if (dst == null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "dst argument is null");
        }
        if (src.implementationIdentifier == null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "expected initialized src");
        }
        if (!RmwImplementation.isOwnIdentifier(src.implementationIdentifier)) {
            return fail(ReturnCode.INCORRECT_RMW_IMPLEMENTATION,
                "src implementation '" + src.implementationIdentifier + "' does not match '"
                    + RmwImplementation.IDENTIFIER + "'");
        }
        if (dst.implementationIdentifier != null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "expected zero-initialized dst");
        }
        Allocator allocator = src.allocator;
        if (allocator == null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "src allocator is null");
        }

        // Everything is built into locals and committed to dst only once all allocations succeeded.
        SecurityOptions security = src.securityOptions.copy(allocator);
        if (security == null) {
            return fail(ReturnCode.BAD_ALLOC, "failed to copy security options");
        }

        DiscoveryOptions discovery = src.discoveryOptions.copy(allocator);
        if (discovery == null) {
            security.release(allocator);
            return fail(ReturnCode.BAD_ALLOC, "failed to copy discovery options");
        }

        String enclaveCopy = null;
        if (src.enclave != null) {
            String source = src.enclave;
            enclaveCopy = allocator.allocate(() -> new String(source));
            if (enclaveCopy == null) {
                discovery.release(allocator);
                security.release(allocator);
                return fail(ReturnCode.BAD_ALLOC, "failed to copy enclave");
            }
        }

        dst.instanceId = src.instanceId;
        dst.implementationIdentifier = RmwImplementation.IDENTIFIER;
        dst.domainId = src.domainId;
        dst.enclave = enclaveCopy;
        dst.securityOptions = security;
        dst.discoveryOptions = discovery;
        dst.allocator = allocator;
        return ReturnCode.OK;
    }

    /**
     * Releases every owned sub-resource and returns the options to the zero state.
     *
     * @return {@link ReturnCode#OK}, {@link ReturnCode#INVALID_ARGUMENT} if not initialized,
     * {@link ReturnCode#INCORRECT_RMW_IMPLEMENTATION} if initialized by another implementation
     */
    public ReturnCode fini() {
        if (implementationIdentifier == null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "expected initialized init_options");
        }
        if (!RmwImplementation.isOwnIdentifier(implementationIdentifier)) {
            return fail(ReturnCode.INCORRECT_RMW_IMPLEMENTATION,
                "init_options implementation '" + implementationIdentifier + "' does not match '"
                    + RmwImplementation.IDENTIFIER + "'");
        }
        if (allocator == null) {
            return fail(ReturnCode.INVALID_ARGUMENT, "init_options allocator is null");
        }

        allocator.deallocate(enclave);
        securityOptions.release(allocator);
        discoveryOptions.release(allocator);
        clear();
        return ReturnCode.OK;
    }

    public boolean isInitialized() {
        return implementationIdentifier != null;
    }

    public long instanceId() {
        return instanceId;
    }

    public void setInstanceId(long instanceId) {
        this.instanceId = instanceId;
    }

    public String implementationIdentifier() {
        return implementationIdentifier;
    }

    /**
     * Stamps a foreign implementation tag. Only meaningful for options handed over from
     * another middleware implementation.
     */
    public void setImplementationIdentifier(String implementationIdentifier) {
        this.implementationIdentifier = implementationIdentifier;
    }

    public long domainId() {
        return domainId;
    }

    public void setDomainId(long domainId) {
        this.domainId = domainId;
    }

    public String enclave() {
        return enclave;
    }

    /**
     * The enclave becomes owned by these options and is handed to the allocator on {@link #fini()}.
     */
    public void setEnclave(String enclave) {
        this.enclave = enclave;
    }

    public SecurityOptions securityOptions() {
        return securityOptions;
    }

    public void setSecurityOptions(SecurityOptions securityOptions) {
        this.securityOptions = securityOptions == null ? SecurityOptions.defaults() : securityOptions;
    }

    public DiscoveryOptions discoveryOptions() {
        return discoveryOptions;
    }

    public void setDiscoveryOptions(DiscoveryOptions discoveryOptions) {
        this.discoveryOptions = discoveryOptions == null ? DiscoveryOptions.zeroInitialized() : discoveryOptions;
    }

    public Allocator allocator() {
        return allocator;
    }

    private void clear() {
        instanceId = 0;
        implementationIdentifier = null;
        domainId = 0;
        enclave = null;
        securityOptions = SecurityOptions.defaults();
        discoveryOptions = DiscoveryOptions.zeroInitialized();
        allocator = null;
    }

    private static ReturnCode fail(ReturnCode code, String message) {
        ErrorState.set(message);
        logger.warn("init_options: {} ({})", message, code);
        return code;
    }

    @Override
    public String toString() {
        return "InitOptions[implementation=" + implementationIdentifier
            + ", domainId=" + domainId
            + ", enclave=" + enclave
            + ", " + securityOptions
            + ", " + discoveryOptions + "]";
    }
}
