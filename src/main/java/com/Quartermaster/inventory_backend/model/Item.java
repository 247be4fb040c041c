package com.Quartermaster.inventory_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;

// Field edits must not rewrite the custody columns owned by the conditional updates
@Entity
@DynamicUpdate
@Table(name = "items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    private String category;

    @Column(unique = true)
    private String barcode;

    private String serialNumber;

    private String storageLocation;

    @Column(name = "is_checked_out", nullable = false)
    @Builder.Default
    private boolean checkedOut = false;

    private String checkedOutBy;

    private LocalDateTime checkedOutDate;

    @Column(columnDefinition = "TEXT")
    private String imageUrl;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdDate;

    @Column(nullable = false)
    private LocalDateTime lastModifiedDate;

    @Override
    public String toString() {
        return "Item{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", barcode='" + barcode + '\'' +
                ", checkedOut=" + checkedOut +
                ", checkedOutBy='" + checkedOutBy + '\'' +
                '}';
    }
}
