package com.eyelevel.invoiceingestion.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    /**
     * Technical detail of a failure, omitted on success.
     */
    private final String error;

    public static <T> ApiResponse<T> ok(final T response, final String displayMessage) {
        return ApiResponse.<T>builder()
                          .response(response)
                          .displayMessage(displayMessage)
                          .showMessage(displayMessage != null)
                          .statusCode(200)
                          .build();
    }

    public static <T> ApiResponse<T> error(final String displayMessage) {
        return error(displayMessage, null);
    }

    public static <T> ApiResponse<T> error(final String displayMessage, final String error) {
        return ApiResponse.<T>builder()
                          .displayMessage(displayMessage)
                          .error(error)
                          .showMessage(true)
                          .build();
    }
}
