package com.Quartermaster.inventory_backend.dto.response;

import com.Quartermaster.inventory_backend.enums.SideEffectType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewOutcomeResponse {
    private ItemRequestResponse request;
    private SideEffect sideEffect;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SideEffect {
        private SideEffectType type;
        private Long itemId;
        private String message;

        public static SideEffect none() {
            return SideEffect.builder().type(SideEffectType.NONE).build();
        }

        public static SideEffect of(SideEffectType type, Long itemId) {
            return SideEffect.builder().type(type).itemId(itemId).build();
        }

        public static SideEffect failed(String message) {
            return SideEffect.builder().type(SideEffectType.FAILED).message(message).build();
        }
    }
}
