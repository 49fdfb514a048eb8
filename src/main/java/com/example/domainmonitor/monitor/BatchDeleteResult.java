package com.example.domainmonitor.monitor;

import java.util.List;

/**
 * Outcome of a batch delete; ids not found for the owner are reported as failed.
 */
public record BatchDeleteResult(int deleted, List<String> failedIds) {
}
