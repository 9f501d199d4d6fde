package io.fleetcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.fleetcontroller.connect.ConnectError;
import io.fleetcontroller.connect.ConnectException;
import io.fleetcontroller.util.IdGenerator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standard error response model for all API operations.
 * Every error carries a random {@code id} that is also written to the log for correlation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    private static final int ERROR_ID_LENGTH = 12;
    private static final String INTERNAL_ERROR_MESSAGE = "Internal error.";

    private String error;
    private String type;
    private String reason;
    private Integer status;
    private String id;
    private String existingTag;

    public static ErrorResponse fromConnectException(ConnectException e) {
        ConnectError kind = e.getError();
        return ErrorResponse.builder()
            .error(kind.isInternal() ? "internal_server_error" : kind.name().toLowerCase())
            .type(kind.name().toLowerCase())
            .reason(kind.getMessage())
            .status(kind.getHttpStatus())
            .id(newErrorId())
            .existingTag(e.getExistingTag())
            .build();
    }

    public static ErrorResponse notFound(String resource) {
        return ErrorResponse.builder()
            .error("resource_not_found_exception")
            .reason(resource + " not found")
            .status(404)
            .id(newErrorId())
            .build();
    }

    public static ErrorResponse conflict(String message) {
        return ErrorResponse.builder()
            .error("conflict")
            .reason(message)
            .status(409)
            .id(newErrorId())
            .build();
    }

    public static ErrorResponse timeout(String message) {
        return ErrorResponse.builder()
            .error("timeout")
            .reason(message)
            .status(408)
            .id(newErrorId())
            .build();
    }

    /**
     * Internal faults never expose their cause to the caller.
     */
    public static ErrorResponse internalError() {
        return ErrorResponse.builder()
            .error("internal_server_error")
            .reason(INTERNAL_ERROR_MESSAGE)
            .status(500)
            .id(newErrorId())
            .build();
    }

    public static ErrorResponse badRequest(String message) {
        return ErrorResponse.builder()
            .error("bad_request")
            .reason(message)
            .status(400)
            .id(newErrorId())
            .build();
    }

    private static String newErrorId() {
        return IdGenerator.randomString(ERROR_ID_LENGTH);
    }
}
