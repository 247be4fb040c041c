package com.Quartermaster.inventory_backend.controller;

import com.Quartermaster.inventory_backend.dto.request.CatalogEntryRequest;
import com.Quartermaster.inventory_backend.dto.response.ApiResponse;
import com.Quartermaster.inventory_backend.dto.response.CatalogEntryResponse;
import com.Quartermaster.inventory_backend.service.CategoryService;
import com.Quartermaster.inventory_backend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryService categoryService;
    private final UserService userService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<CatalogEntryResponse>>> getAllCategories() {
        return ResponseEntity.ok(ApiResponse.success(categoryService.getAllCategories(userService.getCurrentUser())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<CatalogEntryResponse>> getCategoryById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(categoryService.getCategoryById(userService.getCurrentUser(), id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<CatalogEntryResponse>> createCategory(
            @Valid @RequestBody CatalogEntryRequest request) {

        CatalogEntryResponse category = categoryService.createCategory(userService.getCurrentUser(), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(category, "Category created successfully"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<CatalogEntryResponse>> updateCategory(
            @PathVariable Long id,
            @Valid @RequestBody CatalogEntryRequest request) {

        CatalogEntryResponse category = categoryService.updateCategory(userService.getCurrentUser(), id, request);
        return ResponseEntity.ok(ApiResponse.success(category, "Category updated successfully"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteCategory(@PathVariable Long id) {
        categoryService.deleteCategory(userService.getCurrentUser(), id);
        return ResponseEntity.ok(ApiResponse.success(null, "Category deleted successfully"));
    }
}
