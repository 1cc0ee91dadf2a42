package com.hyperhook.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hyperhook.backend.model.ErrorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The single result shape of every trading action. {@code status} is {@code error}
 * exactly when the action had no successful side effect.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseEnvelope {

    private EnvelopeStatus status;

    private String message;

    private Object details;

    private FillDetails filled;

    @JsonProperty("closed_positions")
    private List<PositionItem> closedPositions;

    @JsonProperty("failed_positions")
    private List<PositionItem> failedPositions;

    @JsonProperty("error_type")
    private ErrorType errorType;

    public static ResponseEnvelope success(String message) {
        return ResponseEnvelope.builder()
                .status(EnvelopeStatus.SUCCESS)
                .message(message)
                .build();
    }

    public static ResponseEnvelope error(ErrorType errorType, String message) {
        return ResponseEnvelope.builder()
                .status(EnvelopeStatus.ERROR)
                .errorType(errorType)
                .message(message)
                .build();
    }

    public static ResponseEnvelope error(ErrorType errorType, String message, Object details) {
        return ResponseEnvelope.builder()
                .status(EnvelopeStatus.ERROR)
                .errorType(errorType)
                .message(message)
                .details(details)
                .build();
    }

    @JsonIgnore
    public boolean isError() {
        return status == EnvelopeStatus.ERROR;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == EnvelopeStatus.SUCCESS;
    }
}
