package com.Quartermaster.inventory_backend.model;

import com.Quartermaster.inventory_backend.enums.HistoryAction;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One checkout or checkin of an item. Written once, removed only with its item.
 */
@Entity
@Table(name = "checkout_history", indexes = @Index(name = "idx_history_item", columnList = "item_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(nullable = false)
    private HistoryAction action;

    @Column(nullable = false)
    private String personName;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(columnDefinition = "TEXT")
    private String notes;
}
