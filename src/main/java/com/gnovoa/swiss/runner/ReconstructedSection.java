package com.gnovoa.swiss.runner;

import com.gnovoa.swiss.model.Tournament;

import java.util.Map;

/**
 * Tournament snapshot rebuilt from the store, with the mapping between store ids and the
 * engine's start numbers.
 */
public record ReconstructedSection(Tournament tournament, Map<String, Integer> startNumbers, Map<Integer, String> storeIds) {

    public ReconstructedSection {
        startNumbers = Map.copyOf(startNumbers);
        storeIds = Map.copyOf(storeIds);
    }

    public String storeId(int startNumber) {
        String id = storeIds.get(startNumber);
        if (id == null) throw new IllegalArgumentException("Unknown start number " + startNumber);
        return id;
    }
}
