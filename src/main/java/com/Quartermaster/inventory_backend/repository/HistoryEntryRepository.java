package com.Quartermaster.inventory_backend.repository;

import com.Quartermaster.inventory_backend.model.HistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HistoryEntryRepository extends JpaRepository<HistoryEntry, Long> {

    List<HistoryEntry> findByItemIdOrderByTimestampDescIdDesc(Long itemId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM HistoryEntry h WHERE h.itemId = :itemId")
    int deleteAllByItemId(@Param("itemId") Long itemId);
}
