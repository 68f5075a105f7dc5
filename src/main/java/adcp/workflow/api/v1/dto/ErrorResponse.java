package adcp.workflow.api.v1.dto;

import adcp.workflow.model.ErrorCode;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error") String error) {

    public static ErrorResponse of(ErrorCode code, String message) {
        return new ErrorResponse(false, code.wireName(), message);
    }
}
