package org.kernform.validator.registry;

import org.kernform.validator.model.KernelContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The kernel contracts known within one compilation unit, looked up by name.
 * <p>
 * A registry is populated once through its {@link Builder} and is read-only afterwards, so it
 * can be shared freely by concurrent validation and binding tasks. Names are case-insensitive.
 * Several contracts may share a name; lookups return them in registration order.
 */
public final class ContractRegistry {

    private final Map<String, List<KernelContract>> byName;
    private final List<KernelContract> all;

    private ContractRegistry(Map<String, List<KernelContract>> byName, List<KernelContract> all) {
        this.byName = byName;
        this.all = all;
    }

    /**
     * Creates a new, empty builder.
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns all contracts registered under the given name.
     * @param name The kernel name (case-insensitive).
     * @return The candidates in registration order; empty if the name is unknown.
     */
    public List<KernelContract> lookup(String name) {
        return byName.getOrDefault(normalize(name), List.of());
    }

    /**
     * Checks whether any contract is registered under the name.
     * @param name The kernel name (case-insensitive).
     * @return {@code true} if known.
     */
    public boolean contains(String name) {
        return byName.containsKey(normalize(name));
    }

    /**
     * Returns every registered contract in registration order.
     * @return An unmodifiable list.
     */
    public List<KernelContract> contracts() {
        return all;
    }

    public int size() {
        return all.size();
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Collects contracts before the registry is frozen. Not thread-safe.
     */
    public static final class Builder {
        private static final Logger LOG = LoggerFactory.getLogger(ContractRegistry.class);

        private final Map<String, List<KernelContract>> byName = new LinkedHashMap<>();
        private final List<KernelContract> all = new ArrayList<>();
        private boolean built = false;

        private Builder() {}

        /**
         * Registers a contract. An identical contract that is already registered is ignored.
         * @param contract The contract.
         * @return {@code true} if added, {@code false} if it duplicates a registered contract.
         */
        public boolean register(KernelContract contract) {
            if (built) {
                throw new IllegalStateException("Registry has already been built");
            }
            List<KernelContract> sameName = byName.computeIfAbsent(normalize(contract.name()), k -> new ArrayList<>());
            if (sameName.contains(contract)) {
                LOG.debug("Ignoring duplicate contract {}", contract.signature());
                return false;
            }
            sameName.add(contract);
            all.add(contract);
            return true;
        }

        /**
         * Checks whether a name has been registered so far.
         * @param name The kernel name (case-insensitive).
         * @return {@code true} if known.
         */
        public boolean contains(String name) {
            return byName.containsKey(normalize(name));
        }

        /**
         * Freezes the collected contracts into a registry. The builder cannot be used afterwards.
         * @return The registry.
         */
        public ContractRegistry build() {
            built = true;
            Map<String, List<KernelContract>> frozen = new LinkedHashMap<>();
            byName.forEach((name, contracts) -> frozen.put(name, List.copyOf(contracts)));
            LOG.debug("Built contract registry with {} contract(s) under {} name(s)", all.size(), frozen.size());
            return new ContractRegistry(Collections.unmodifiableMap(frozen), List.copyOf(all));
        }
    }
}
