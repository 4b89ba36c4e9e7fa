package com.shomee.spices.dto;

import com.shomee.spices.model.Lead;

import jakarta.validation.constraints.NotNull;

public class LeadDto {

    public static final String ACKNOWLEDGEMENT = "Thanks for reaching out!";

    public record CreateLeadRequest(
        @NotNull String name,
        @NotNull String email,
        String message,
        String source
    ) {
        public Lead toLead() {
            return new Lead(name, email, message, source != null ? source : Lead.DEFAULT_SOURCE);
        }
    }

    public record LeadCreatedResponse(String id, String message) {
        public static LeadCreatedResponse acknowledge(String id) {
            return new LeadCreatedResponse(id, ACKNOWLEDGEMENT);
        }
    }
}
