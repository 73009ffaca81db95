package com.transit.ingest.etl.contract;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Component
public class ContractRegistry {
    private final Map<String, DataContract> contracts = new LinkedHashMap<>();

    public ContractRegistry() {
        register(TransitContracts.busStops());
        register(TransitContracts.busStopRoutes());
        register(TransitContracts.busPositions());
    }

    public final void register(DataContract contract) {
        contracts.put(contract.name(), contract);
    }

    public DataContract get(String dataset) {
        DataContract contract = dataset == null ? null : contracts.get(dataset.trim());
        if (contract == null) {
            throw new IllegalArgumentException("Unknown dataset '" + dataset + "'; known: " + contracts.keySet());
        }
        return contract;
    }

    public Set<String> datasets() {
        return Set.copyOf(contracts.keySet());
    }
}
