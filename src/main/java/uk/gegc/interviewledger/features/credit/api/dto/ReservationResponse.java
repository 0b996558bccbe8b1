package uk.gegc.interviewledger.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "ReservationResponse")
public record ReservationResponse(
        @Schema(description = "Id of the newly scheduled interview")
        UUID interviewId
) {}
