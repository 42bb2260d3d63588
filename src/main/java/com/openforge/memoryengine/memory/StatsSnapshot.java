package com.openforge.memoryengine.memory;

import java.util.Map;

/**
 * Point-in-time statistics for one tenant collection.
 *
 * @param collectionName   internal collection/partition name of the tenant
 * @param totalRecords     all records, expired ones included
 * @param recentRecords24h records created in the last 24 hours
 * @param byScopeAndKind   record count per (scope, kind)
 * @param byUser           record count per user_id ("" for records without one)
 * @param expiredRecords   records past their TTL and awaiting pruning
 * @param metrics          engine-wide counters and rolling latencies
 */
public record StatsSnapshot(
        String                collectionName,
        long                  totalRecords,
        long                  recentRecords24h,
        Map<ScopeKind, Long>  byScopeAndKind,
        Map<String, Long>     byUser,
        long                  expiredRecords,
        EngineMetrics.Snapshot metrics
) {}
