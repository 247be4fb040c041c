package com.Quartermaster.inventory_backend.repository;

import com.Quartermaster.inventory_backend.model.Item;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {

    List<Item> findAllByOrderByNameAsc();

    /**
     * Row-locks the item until the surrounding transaction ends. Custody updates on the
     * same item wait behind the lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Item i WHERE i.id = :id")
    Optional<Item> findByIdForUpdate(@Param("id") Long id);

    boolean existsByBarcode(String barcode);

    boolean existsByBarcodeAndIdNot(String barcode, Long id);

    @Query("SELECT i FROM Item i WHERE " +
            "LOWER(i.name) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(i.description) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(i.barcode) LIKE LOWER(CONCAT('%', :query, '%')) " +
            "ORDER BY i.name")
    List<Item> search(@Param("query") String query);

    /**
     * Available -> checked out. Returns 0 when the item is missing or already checked out.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Item i SET i.checkedOut = true, i.checkedOutBy = :person, " +
            "i.checkedOutDate = :now, i.lastModifiedDate = :now " +
            "WHERE i.id = :id AND i.checkedOut = false")
    int checkOutIfAvailable(@Param("id") Long id,
                            @Param("person") String person,
                            @Param("now") LocalDateTime now);

    /**
     * Checked out -> available. Returns 0 when the item is missing or not checked out.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Item i SET i.checkedOut = false, i.checkedOutBy = NULL, " +
            "i.checkedOutDate = NULL, i.lastModifiedDate = :now " +
            "WHERE i.id = :id AND i.checkedOut = true")
    int checkInIfCheckedOut(@Param("id") Long id,
                            @Param("now") LocalDateTime now);

    long countByCheckedOutTrue();

    @Query("SELECT i.category, COUNT(i) FROM Item i GROUP BY i.category")
    List<Object[]> countByCategory();
}
