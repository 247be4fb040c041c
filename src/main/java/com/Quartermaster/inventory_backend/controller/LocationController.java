package com.Quartermaster.inventory_backend.controller;

import com.Quartermaster.inventory_backend.dto.request.CatalogEntryRequest;
import com.Quartermaster.inventory_backend.dto.response.ApiResponse;
import com.Quartermaster.inventory_backend.dto.response.CatalogEntryResponse;
import com.Quartermaster.inventory_backend.service.LocationService;
import com.Quartermaster.inventory_backend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/locations")
@RequiredArgsConstructor
public class LocationController {

    private final LocationService locationService;
    private final UserService userService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<CatalogEntryResponse>>> getAllLocations() {
        return ResponseEntity.ok(ApiResponse.success(locationService.getAllLocations(userService.getCurrentUser())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<CatalogEntryResponse>> getLocationById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(locationService.getLocationById(userService.getCurrentUser(), id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<CatalogEntryResponse>> createLocation(
            @Valid @RequestBody CatalogEntryRequest request) {

        CatalogEntryResponse location = locationService.createLocation(userService.getCurrentUser(), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(location, "Location created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<CatalogEntryResponse>> updateLocation(
            @PathVariable Long id,
            @Valid @RequestBody CatalogEntryRequest request) {

        CatalogEntryResponse location = locationService.updateLocation(userService.getCurrentUser(), id, request);
        return ResponseEntity.ok(ApiResponse.success(location, "Location updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteLocation(@PathVariable Long id) {
        locationService.deleteLocation(userService.getCurrentUser(), id);
        return ResponseEntity.ok(ApiResponse.success(null, "Location deleted successfully"));
    }
}
