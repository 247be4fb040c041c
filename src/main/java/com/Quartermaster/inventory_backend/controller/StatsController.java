package com.Quartermaster.inventory_backend.controller;

import com.Quartermaster.inventory_backend.dto.response.ApiResponse;
import com.Quartermaster.inventory_backend.dto.response.InventoryStatsResponse;
import com.Quartermaster.inventory_backend.service.ItemService;
import com.Quartermaster.inventory_backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatsController {

    private final ItemService itemService;
    private final UserService userService;

    @GetMapping("/api/stats")
    public ResponseEntity<ApiResponse<InventoryStatsResponse>> getStats() {
        return ResponseEntity.ok(ApiResponse.success(itemService.getStats(userService.getCurrentUser())));
    }
}
