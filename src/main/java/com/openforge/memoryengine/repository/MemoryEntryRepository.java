package com.openforge.memoryengine.repository;

import com.openforge.memoryengine.domain.MemoryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface MemoryEntryRepository extends JpaRepository<MemoryEntry, Long> {

    List<MemoryEntry> findByCollectionNameAndMemoryIdIn(String collectionName, Collection<String> memoryIds);

    List<MemoryEntry> findByCollectionNameOrderByCreatedAtMsDesc(String collectionName, Pageable pageable);

    long countByCollectionName(String collectionName);

    long countByCollectionNameAndCreatedAtMsGreaterThanEqual(String collectionName, long sinceMs);

    long countByCollectionNameAndExpiresAtMsLessThanEqual(String collectionName, long nowMs);

    @Query("select e.memoryId from MemoryEntry e "
            + "where e.collectionName = :collection and e.expiresAtMs <= :nowMs")
    List<String> findExpiredMemoryIds(@Param("collection") String collection, @Param("nowMs") long nowMs);

    @Query("select e.scope, e.kind, count(e) from MemoryEntry e "
            + "where e.collectionName = :collection group by e.scope, e.kind")
    List<Object[]> countGroupedByScopeAndKind(@Param("collection") String collection);

    @Query("select e.userId, count(e) from MemoryEntry e "
            + "where e.collectionName = :collection group by e.userId")
    List<Object[]> countGroupedByUser(@Param("collection") String collection);

    @Query("select distinct e.collectionName from MemoryEntry e")
    List<String> findDistinctCollectionNames();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from MemoryEntry e where e.collectionName = :collection and e.memoryId in :ids")
    int deleteByCollectionNameAndMemoryIdIn(@Param("collection") String collection,
                                            @Param("ids") Collection<String> ids);
}
