package com.trackit.tracking.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Ship24TrackRequest(String trackingNumber, List<String> courierCode) {}
