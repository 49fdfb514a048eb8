package com.example.domainmonitor.monitor;

import java.util.List;

/**
 * Outcome of a batch add. {@code total} counts the submitted items.
 */
public record BatchAddResult(int total, int added, List<Item> succeeded, List<Item> failed) {

    public record Item(String name, String region, String domainId,
                       DomainOperationException.Reason reason, String message) {

        static Item success(String name, String region, String domainId) {
            return new Item(name, region, domainId, null, null);
        }

        static Item failure(String name, String region, DomainOperationException.Reason reason, String message) {
            return new Item(name, region, null, reason, message);
        }
    }
}
