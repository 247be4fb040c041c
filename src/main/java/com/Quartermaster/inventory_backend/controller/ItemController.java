package com.Quartermaster.inventory_backend.controller;

import com.Quartermaster.inventory_backend.dto.request.CustodyRequest;
import com.Quartermaster.inventory_backend.dto.request.ItemCreateRequest;
import com.Quartermaster.inventory_backend.dto.request.ItemUpdateRequest;
import com.Quartermaster.inventory_backend.dto.response.ApiResponse;
import com.Quartermaster.inventory_backend.dto.response.HistoryEntryResponse;
import com.Quartermaster.inventory_backend.dto.response.ItemResponse;
import com.Quartermaster.inventory_backend.service.ItemService;
import com.Quartermaster.inventory_backend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/items")
@RequiredArgsConstructor
public class ItemController {

    private final ItemService itemService;
    private final UserService userService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<ItemResponse>>> getAllItems() {
        List<ItemResponse> items = itemService.getAllItems(userService.getCurrentUser());
        return ResponseEntity.ok(ApiResponse.success(items));
    }

    @GetMapping("/search")
    public ResponseEntity<ApiResponse<List<ItemResponse>>> searchItems(@RequestParam("q") String query) {
        List<ItemResponse> items = itemService.searchItems(userService.getCurrentUser(), query);
        return ResponseEntity.ok(ApiResponse.success(items));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ItemResponse>> getItemById(@PathVariable Long id) {
        ItemResponse item = itemService.getItemById(userService.getCurrentUser(), id);
        return ResponseEntity.ok(ApiResponse.success(item));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ItemResponse>> createItem(@Valid @RequestBody ItemCreateRequest request) {
        ItemResponse item = itemService.createItem(userService.getCurrentUser(), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(item, "Item created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ItemResponse>> updateItem(
            @PathVariable Long id,
            @Valid @RequestBody ItemUpdateRequest request) {

        ItemResponse item = itemService.updateItem(userService.getCurrentUser(), id, request);
        return ResponseEntity.ok(ApiResponse.success(item, "Item updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteItem(@PathVariable Long id) {
        itemService.deleteItem(userService.getCurrentUser(), id);
        return ResponseEntity.ok(ApiResponse.success(null, "Item deleted successfully"));
    }

    @PostMapping("/{id}/checkout")
    public ResponseEntity<ApiResponse<ItemResponse>> checkoutItem(
            @PathVariable Long id,
            @Valid @RequestBody CustodyRequest request) {

        ItemResponse item = itemService.checkoutItem(userService.getCurrentUser(), id, request);
        return ResponseEntity.ok(ApiResponse.success(item,
                String.format("Item checked out to %s", item.getCheckedOutBy())));
    }

    @PostMapping("/{id}/checkin")
    public ResponseEntity<ApiResponse<ItemResponse>> checkinItem(
            @PathVariable Long id,
            @Valid @RequestBody CustodyRequest request) {

        ItemResponse item = itemService.checkinItem(userService.getCurrentUser(), id, request);
        return ResponseEntity.ok(ApiResponse.success(item, "Item checked in successfully"));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<ApiResponse<List<HistoryEntryResponse>>> getItemHistory(@PathVariable Long id) {
        List<HistoryEntryResponse> history = itemService.getItemHistory(userService.getCurrentUser(), id);
        return ResponseEntity.ok(ApiResponse.success(history));
    }
}
