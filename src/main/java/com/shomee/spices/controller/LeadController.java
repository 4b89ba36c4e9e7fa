package com.shomee.spices.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.shomee.spices.dto.LeadDto.CreateLeadRequest;
import com.shomee.spices.dto.LeadDto.LeadCreatedResponse;
import com.shomee.spices.service.LeadService;

@RestController
public class LeadController {

    private final LeadService leadService;

    public LeadController(LeadService leadService) {
        this.leadService = leadService;
    }

    @PostMapping("/lead")
    @ResponseStatus(HttpStatus.CREATED)
    public LeadCreatedResponse create(@RequestBody CreateLeadRequest request) {
        return LeadCreatedResponse.acknowledge(leadService.create(request));
    }
}
